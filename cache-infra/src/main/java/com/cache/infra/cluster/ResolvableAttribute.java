package com.cache.infra.cluster;

import java.util.Objects;

import software.amazon.awscdk.Token;

/**
 * Attribute of a deployed resource. Until CloudFormation materializes the
 * resource the value is only a token that resolves at deploy time.
 */
public sealed interface ResolvableAttribute permits ResolvableAttribute.Unresolved, ResolvableAttribute.Resolved {

    static ResolvableAttribute of(String value) {
        Objects.requireNonNull(value, "value");
        return Token.isUnresolved(value) ? new Unresolved(value) : new Resolved(value);
    }

    boolean isResolved();

    /**
     * The raw string, token or concrete value. Fine to hand to other constructs,
     * not fine to parse.
     */
    String asString();

    record Unresolved(String token) implements ResolvableAttribute {
        @Override
        public boolean isResolved() {
            return false;
        }

        @Override
        public String asString() {
            return token;
        }
    }

    record Resolved(String value) implements ResolvableAttribute {
        @Override
        public boolean isResolved() {
            return true;
        }

        @Override
        public String asString() {
            return value;
        }
    }
}
