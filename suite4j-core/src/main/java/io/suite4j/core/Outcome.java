package io.suite4j.core;

public enum Outcome {
    PASS {
        @Override
        public boolean isFailure() {
            return false;
        }
    },
    FAIL {
        @Override
        public boolean isFailure() {
            return true;
        }
    },
    ERROR {
        @Override
        public boolean isFailure() {
            return true;
        }
    };

    public abstract boolean isFailure();
}
