package com.objecty.value;

/**
 * Capability an {@link Aggregate} subclass implements to take over its own deep copy.
 * Cloning stores whatever this returns directly, so the result must be safe for the
 * caller to mutate independently of the original.
 */
public interface CustomClone {
    Value cloneSelf();
}
