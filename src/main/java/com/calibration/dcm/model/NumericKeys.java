package com.calibration.dcm.model;

import java.util.Map;

final class NumericKeys {

    private NumericKeys() {
    }

    static <V> V lookup(Map<Number, V> map, Number key) {
        V exact = map.get(key);
        if (exact != null || key == null) {
            return exact;
        }
        double wanted = key.doubleValue();
        for (Map.Entry<Number, V> entry : map.entrySet()) {
            if (Double.compare(entry.getKey().doubleValue(), wanted) == 0) {
                return entry.getValue();
            }
        }
        return null;
    }
}
