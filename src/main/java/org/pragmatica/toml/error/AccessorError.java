package org.pragmatica.toml.error;

import org.pragmatica.toml.tree.TomlValue;
import org.pragmatica.toml.tree.ValueKind;

/**
 * Failure of a single typed lookup or conversion on an already parsed tree.
 * Never invalidates the tree or other lookups.
 */
public sealed interface AccessorError {
    /**
     * Key the failure refers to, empty while a conversion runs without key context.
     */
    String key();

    String message();

    /**
     * Attach the key a conversion was reading. A missing value becomes {@link InvalidKey};
     * errors that already name a key keep it.
     */
    default AccessorError withKey(String key) {
        return this;
    }

    /**
     * A conversion was given no value.
     */
    record Missing() implements AccessorError {
        @Override
        public String key() {
            return "";
        }

        @Override
        public String message() {
            return "No value to convert";
        }

        @Override
        public AccessorError withKey(String key) {
            return new InvalidKey(key);
        }
    }

    /**
     * No value is stored under the key.
     */
    record InvalidKey(String key) implements AccessorError {
        @Override
        public String message() {
            return "No value for key '" + key + "'";
        }
    }

    /**
     * A value exists but has another kind. The value is kept so the caller can still use it.
     */
    record TypeMismatch(String key, TomlValue found, ValueKind expected) implements AccessorError {
        public static TypeMismatch of(TomlValue found, ValueKind expected) {
            return new TypeMismatch("", found, expected);
        }

        @Override
        public String message() {
            var subject = key.isEmpty()
                          ? "Value"
                          : "Value for key '" + key + "'";
            return subject + " is " + found.kind()
                                           .displayName() + ", expected " + expected.displayName();
        }

        @Override
        public AccessorError withKey(String key) {
            return this.key.isEmpty()
                   ? new TypeMismatch(key, found, expected)
                   : this;
        }
    }
}
