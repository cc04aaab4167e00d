package com.calibration.dcm.parser;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.calibration.dcm.model.ElementShape;

/**
 * Field keywords of a block body and the element shapes that accept them.
 */
public enum BlockKeyword {
    LANGNAME("LANGNAME", EnumSet.allOf(ElementShape.class)),
    DISPLAYNAME("DISPLAYNAME", EnumSet.allOf(ElementShape.class)),
    FUNKTION("FUNKTION", EnumSet.allOf(ElementShape.class)),
    EINHEIT_W("EINHEIT_W", valueShapes()),
    EINHEIT_X("EINHEIT_X", EnumSet.of(ElementShape.LINE, ElementShape.MAP, ElementShape.DISTRIBUTION)),
    EINHEIT_Y("EINHEIT_Y", EnumSet.of(ElementShape.MAP)),
    WERT("WERT", valueShapes()),
    TEXT("TEXT", valueShapes()),
    ST_X("ST/X", EnumSet.of(ElementShape.LINE, ElementShape.MAP, ElementShape.DISTRIBUTION)),
    ST_Y("ST/Y", EnumSet.of(ElementShape.MAP)),
    VAR("VAR", EnumSet.allOf(ElementShape.class));

    private static final Map<String, BlockKeyword> BY_TOKEN = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(BlockKeyword::getToken, Function.identity()));

    private final String token;
    private final Set<ElementShape> shapes;

    BlockKeyword(String token, Set<ElementShape> shapes) {
        this.token = token;
        this.shapes = shapes;
    }

    public String getToken() {
        return token;
    }

    public boolean isAllowedIn(ElementShape shape) {
        return shapes.contains(shape);
    }

    public static Optional<BlockKeyword> fromToken(String token) {
        return Optional.ofNullable(BY_TOKEN.get(token));
    }

    private static Set<ElementShape> valueShapes() {
        return EnumSet.of(ElementShape.SCALAR, ElementShape.BLOCK, ElementShape.LINE, ElementShape.MAP);
    }
}
