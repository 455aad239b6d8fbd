package com.challenges.mxql.payload;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Typed value tree of a command payload. Objects keep their keys in source order.
 */
public sealed interface PayloadNode {

    /**
     * Text of a string or bare identifier, empty for every other kind.
     */
    default Optional<String> text() {
        return Optional.empty();
    }

    record PayloadObject(MutableMap<String, PayloadNode> fields) implements PayloadNode {
        public static PayloadObject empty() {
            return new PayloadObject(MapAdapter.adapt(new LinkedHashMap<>()));
        }

        public PayloadObject with(String key, PayloadNode value) {
            MutableMap<String, PayloadNode> newFields = MapAdapter.adapt(new LinkedHashMap<>(fields));
            newFields.put(key, value);
            return new PayloadObject(newFields);
        }

        public Optional<PayloadNode> get(String key) {
            return Optional.ofNullable(fields.get(key));
        }

        /**
         * Value of the first key present, looked up in the given order.
         */
        public Optional<PayloadNode> getAny(String... keys) {
            for (String key : keys) {
                PayloadNode value = fields.get(key);
                if (value != null) {
                    return Optional.of(value);
                }
            }
            return Optional.empty();
        }

        public boolean has(String key) {
            return fields.containsKey(key);
        }
    }

    record PayloadArray(MutableList<PayloadNode> elements) implements PayloadNode {
        public static PayloadArray empty() {
            return new PayloadArray(Lists.mutable.empty());
        }

        public PayloadArray with(PayloadNode element) {
            MutableList<PayloadNode> newElements = Lists.mutable.ofAll(elements);
            newElements.add(element);
            return new PayloadArray(newElements);
        }
    }

    record PayloadString(String value) implements PayloadNode {
        @Override
        public Optional<String> text() {
            return Optional.of(value);
        }
    }

    /**
     * Unquoted word accepted as a string literal, e.g. {@code oname} or {@code cpu(xos)}.
     */
    record PayloadIdentifier(String name) implements PayloadNode {
        @Override
        public Optional<String> text() {
            return Optional.of(name);
        }
    }

    sealed interface PayloadNumber extends PayloadNode {
        String toLiteral();
        Number numberValue();

        record PayloadLong(long value) implements PayloadNumber {
            @Override
            public String toLiteral() {
                return Long.toString(value);
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        record PayloadDouble(double value) implements PayloadNumber {
            @Override
            public String toLiteral() {
                if (value == (long) value && !Double.isInfinite(value) && !Double.isNaN(value)) {
                    return Long.toString((long) value);
                }
                return Double.toString(value);
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        static PayloadNumber of(long value) {
            return new PayloadLong(value);
        }

        static PayloadNumber of(double value) {
            return new PayloadDouble(value);
        }
    }

    record PayloadBoolean(boolean value) implements PayloadNode {}
    record PayloadNull() implements PayloadNode {}
}
