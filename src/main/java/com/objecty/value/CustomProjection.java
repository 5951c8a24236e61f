package com.objecty.value;

/** Capability an {@link Aggregate} subclass implements to supply its own plain form for projection. */
public interface CustomProjection {
    Value toPlain();
}
