package io.foreman.api.scaling;

public enum ScalingDirection {
    SCALE_UP,
    SCALE_DOWN,
    MAINTAIN
}
