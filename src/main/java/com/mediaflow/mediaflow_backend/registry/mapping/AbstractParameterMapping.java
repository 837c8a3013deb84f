package com.mediaflow.mediaflow_backend.registry.mapping;

import com.mediaflow.mediaflow_backend.model.plan.UnifiedOptions;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

abstract class AbstractParameterMapping implements ParameterMapping {

    protected final String modelId;
    private final Set<String> consumedFields;
    private final Set<String> roundTripFields;

    protected AbstractParameterMapping(String modelId, Set<String> consumedFields, Set<String> roundTripFields) {
        this.modelId = modelId;
        this.consumedFields = consumedFields;
        this.roundTripFields = roundTripFields;
    }

    @Override
    public Set<String> lossyFields() {
        Set<String> lossy = new LinkedHashSet<>(UnifiedOptions.FIELD_NAMES);
        lossy.removeAll(roundTripFields);
        return lossy;
    }

    /** Records a note for each present field this model has no use for. */
    protected void noteUnsupported(UnifiedOptions unified, List<String> coercions) {
        unified.presentFields().forEach((field, value) -> {
            if (!consumedFields.contains(field)) {
                coercions.add(field + " is not supported by " + modelId + " and was dropped");
            }
        });
    }

    protected static void put(Map<String, Object> target, String key, Object value) {
        if (value != null) target.put(key, value);
    }

    protected static String string(Map<String, Object> source, String key) {
        Object value = source.get(key);
        return value != null ? value.toString() : null;
    }

    protected static Integer integer(Map<String, Object> source, String key) {
        Object value = source.get(key);
        if (value instanceof Number n) return n.intValue();
        if (value instanceof String s && !s.isBlank()) return Integer.valueOf(s.trim());
        return null;
    }

    protected static String firstString(Map<String, Object> source, String key) {
        Object value = source.get(key);
        if (value instanceof List<?> list && !list.isEmpty() && list.get(0) != null) {
            return list.get(0).toString();
        }
        return value instanceof String s ? s : null;
    }

    protected static Map<String, Object> newOptions() {
        return new LinkedHashMap<>();
    }
}
