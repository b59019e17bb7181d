package com.proclang;

import com.proclang.ast.Exp;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public abstract class Val {
    private Val() {
    }

    public static Val of(long value) {
        return new IntVal(value);
    }

    public static Val of(boolean value) {
        return value ? BoolVal.TRUE : BoolVal.FALSE;
    }

    public static Val exn(String message) {
        return new ExnVal(message);
    }

    public static final class IntVal extends Val {
        private final long value;

        public IntVal(long value) {
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof IntVal && ((IntVal) obj).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class BoolVal extends Val {
        public static final BoolVal TRUE = new BoolVal(true);
        public static final BoolVal FALSE = new BoolVal(false);

        private final boolean value;

        private BoolVal(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof BoolVal && ((BoolVal) obj).value == value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return value ? "True" : "False";
        }
    }

    public static final class CloVal extends Val {
        private final List<String> parameters;
        private final Exp body;
        private final PersistentMap<String, Val> env;

        public CloVal(List<String> parameters, Exp body, PersistentMap<String, Val> env) {
            this.parameters = List.copyOf(parameters);
            this.body = body;
            this.env = env;
        }

        public List<String> getParameters() {
            return parameters;
        }

        public Exp getBody() {
            return body;
        }

        public PersistentMap<String, Val> getEnv() {
            return env;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof CloVal)) return false;
            CloVal other = (CloVal) obj;
            return parameters.equals(other.parameters) && body.equals(other.body) && env.equals(other.env);
        }

        @Override
        public int hashCode() {
            return Objects.hash(parameters, body, env);
        }

        /** Renders as {@code <[x, y], body, {a=1, b=True}>} with the environment in key order. */
        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("<[");
            sb.append(String.join(", ", parameters));
            sb.append("], ").append(body).append(", {");
            boolean first = true;
            for (Map.Entry<String, Val> entry : env.getSortedEntries()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append('=').append(entry.getValue());
                first = false;
            }
            sb.append("}>");
            return sb.toString();
        }
    }

    public static final class ExnVal extends Val {
        private final String message;

        public ExnVal(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof ExnVal && ((ExnVal) obj).message.equals(message);
        }

        @Override
        public int hashCode() {
            return message.hashCode();
        }

        @Override
        public String toString() {
            return "exn: " + message;
        }
    }
}
