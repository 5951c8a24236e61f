package com.objecty.value;

import java.util.List;

/** Function carried by a FUNC value. */
public interface Invocable {
    Value call(Aggregate self, List<Value> args);
}
