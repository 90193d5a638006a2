package com.newtype.ast;

import java.util.List;
import java.util.Objects;

/**
 * The bindings an import declaration introduces.
 */
public sealed interface ImportClause extends Node permits
    ImportClause.Default,
    ImportClause.Namespace,
    ImportClause.Named,
    ImportClause.DefaultAndNamespace,
    ImportClause.DefaultAndNamed {

    record Default(String binding) implements ImportClause {
        public Default {
            Objects.requireNonNull(binding, "binding");
        }
    }

    record Namespace(String binding) implements ImportClause {
        public Namespace {
            Objects.requireNonNull(binding, "binding");
        }
    }

    record Named(List<ImportSpecifier> specifiers) implements ImportClause {
        public Named {
            specifiers = List.copyOf(specifiers);
        }
    }

    record DefaultAndNamespace(String defaultBinding, String namespaceBinding) implements ImportClause {
        public DefaultAndNamespace {
            Objects.requireNonNull(defaultBinding, "defaultBinding");
            Objects.requireNonNull(namespaceBinding, "namespaceBinding");
        }
    }

    record DefaultAndNamed(String defaultBinding, List<ImportSpecifier> specifiers) implements ImportClause {
        public DefaultAndNamed {
            Objects.requireNonNull(defaultBinding, "defaultBinding");
            specifiers = List.copyOf(specifiers);
        }
    }
}
