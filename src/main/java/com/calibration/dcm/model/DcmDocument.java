package com.calibration.dcm.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.calibration.dcm.exception.DuplicateNameException;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;

/**
 * Represents a fully parsed DCM file: header, format version, function list and
 * all elements in file order with a by-name index.
 */
@Getter
public class DcmDocument {
    public static final String DEFAULT_FORMAT_VERSION = "2.0";

    @Setter
    @NonNull
    private String header = "";
    @Setter
    @NonNull
    private String formatVersion = DEFAULT_FORMAT_VERSION;
    @Setter
    @NonNull
    private DcmDiagnostics diagnostics = new DcmDiagnostics();

    @Getter(AccessLevel.NONE)
    private final List<DcmFunction> functions = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final List<DcmElement> elements = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final Map<String, DcmElement> elementsByName = new HashMap<>();

    public void addFunction(DcmFunction function) {
        functions.add(function);
    }

    /**
     * Adds an element at the end of the document.
     *
     * @throws DuplicateNameException if an element with the same name exists
     */
    public void addElement(DcmElement element) {
        if (elementsByName.containsKey(element.getName())) {
            throw new DuplicateNameException(element.getName(), element.getSourceLine());
        }
        elementsByName.put(element.getName(), element);
        elements.add(element);
    }

    public boolean removeElement(String name) {
        DcmElement removed = elementsByName.remove(name);
        return removed != null && elements.remove(removed);
    }

    public Optional<DcmElement> findElement(String name) {
        return Optional.ofNullable(elementsByName.get(name));
    }

    public List<DcmFunction> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    /**
     * All elements in insertion (file) order.
     */
    public List<DcmElement> getElements() {
        return Collections.unmodifiableList(elements);
    }

    public List<DcmElement> getElements(ElementKind kind) {
        return elements.stream()
                .filter(e -> e.getKind() == kind)
                .toList();
    }

    public List<ScalarParameter> getParameters() {
        return ofKind(ElementKind.PARAMETER, ScalarParameter.class);
    }

    public List<ParameterBlock> getParameterBlocks() {
        return ofKind(ElementKind.PARAMETER_BLOCK, ParameterBlock.class);
    }

    public List<CharacteristicLine> getCharacteristicLines() {
        return ofKind(ElementKind.CHARACTERISTIC_LINE, CharacteristicLine.class);
    }

    public List<CharacteristicLine> getFixedCharacteristicLines() {
        return ofKind(ElementKind.FIXED_CHARACTERISTIC_LINE, CharacteristicLine.class);
    }

    public List<CharacteristicLine> getGroupCharacteristicLines() {
        return ofKind(ElementKind.GROUP_CHARACTERISTIC_LINE, CharacteristicLine.class);
    }

    public List<CharacteristicMap> getCharacteristicMaps() {
        return ofKind(ElementKind.CHARACTERISTIC_MAP, CharacteristicMap.class);
    }

    public List<CharacteristicMap> getFixedCharacteristicMaps() {
        return ofKind(ElementKind.FIXED_CHARACTERISTIC_MAP, CharacteristicMap.class);
    }

    public List<CharacteristicMap> getGroupCharacteristicMaps() {
        return ofKind(ElementKind.GROUP_CHARACTERISTIC_MAP, CharacteristicMap.class);
    }

    public List<Distribution> getDistributions() {
        return ofKind(ElementKind.DISTRIBUTION, Distribution.class);
    }

    private <T extends DcmElement> List<T> ofKind(ElementKind kind, Class<T> type) {
        return elements.stream()
                .filter(e -> e.getKind() == kind)
                .map(type::cast)
                .toList();
    }
}
