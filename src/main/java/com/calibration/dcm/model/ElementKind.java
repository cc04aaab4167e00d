package com.calibration.dcm.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Block kinds of the DCM format with their opening keyword.
 */
public enum ElementKind {
    PARAMETER("FESTWERT", ElementShape.SCALAR),
    PARAMETER_BLOCK("FESTWERTEBLOCK", ElementShape.BLOCK),
    CHARACTERISTIC_LINE("KENNLINIE", ElementShape.LINE),
    FIXED_CHARACTERISTIC_LINE("FESTKENNLINIE", ElementShape.LINE),
    GROUP_CHARACTERISTIC_LINE("GRUPPENKENNLINIE", ElementShape.LINE),
    CHARACTERISTIC_MAP("KENNFELD", ElementShape.MAP),
    FIXED_CHARACTERISTIC_MAP("FESTKENNFELD", ElementShape.MAP),
    GROUP_CHARACTERISTIC_MAP("GRUPPENKENNFELD", ElementShape.MAP),
    DISTRIBUTION("STUETZSTELLENVERTEILUNG", ElementShape.DISTRIBUTION);

    private static final Map<String, ElementKind> BY_KEYWORD = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ElementKind::getKeyword, Function.identity()));

    private final String keyword;
    private final ElementShape shape;

    ElementKind(String keyword, ElementShape shape) {
        this.keyword = keyword;
        this.shape = shape;
    }

    public String getKeyword() {
        return keyword;
    }

    public ElementShape getShape() {
        return shape;
    }

    /**
     * Exact, case-sensitive match of a whole keyword token.
     */
    public static Optional<ElementKind> fromKeyword(String keyword) {
        return Optional.ofNullable(BY_KEYWORD.get(keyword));
    }
}
