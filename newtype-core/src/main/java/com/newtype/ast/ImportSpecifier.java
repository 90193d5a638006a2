package com.newtype.ast;

import java.util.Objects;

public sealed interface ImportSpecifier extends Node permits
    ImportSpecifier.Binding,
    ImportSpecifier.Alias {

    record Binding(String name) implements ImportSpecifier {
        public Binding {
            Objects.requireNonNull(name, "name");
        }
    }

    /** {@code from as to} */
    record Alias(String from, String to) implements ImportSpecifier {
        public Alias {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }
}
