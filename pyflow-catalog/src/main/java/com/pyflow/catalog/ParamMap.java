package com.pyflow.catalog;

import com.pyflow.model.transform.Params;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Ordered parameter map that skips nulls and empty collections. */
final class ParamMap {

    private final Map<String, Object> map = new LinkedHashMap<>();

    static ParamMap create() {
        return new ParamMap();
    }

    ParamMap put(String key, Object value) {
        if (value == null) return this;
        if (value instanceof Collection<?> c && c.isEmpty()) return this;
        if (value instanceof Map<?, ?> m && m.isEmpty()) return this;
        map.put(key, value);
        return this;
    }

    ParamMap putIfAbsent(String key, Object value) {
        if (!map.containsKey(key)) put(key, value);
        return this;
    }

    /** Receiver columns as {@code columns}, or a single {@code column} when there is exactly one. */
    ParamMap receiver(CallArguments args) {
        List<String> cols = args.receiverColumns();
        if (cols.size() == 1) put(Params.COLUMN, cols.get(0));
        else put(Params.COLUMNS, cols);
        return this;
    }

    Map<String, Object> map() {
        return map;
    }
}
