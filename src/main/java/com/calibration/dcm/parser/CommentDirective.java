package com.calibration.dcm.parser;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

import com.calibration.dcm.model.DcmElement;

/**
 * Metadata carried inside block comments, e.g. {@code *SSTX DISTRIBUTION_X} binding
 * the x axis to a distribution. New directives only need a constant here.
 */
public enum CommentDirective {
    SSTX("SSTX", DcmElement::setXMapping, DcmElement::getXMapping),
    SSTY("SSTY", DcmElement::setYMapping, DcmElement::getYMapping);

    private final String keyword;
    private final BiConsumer<DcmElement, String> setter;
    private final Function<DcmElement, String> getter;

    CommentDirective(String keyword, BiConsumer<DcmElement, String> setter, Function<DcmElement, String> getter) {
        this.keyword = keyword;
        this.setter = setter;
        this.getter = getter;
    }

    public String getKeyword() {
        return keyword;
    }

    public void apply(DcmElement element, String argument) {
        setter.accept(element, argument);
    }

    public String valueOf(DcmElement element) {
        return getter.apply(element);
    }

    /**
     * Matches comment content (marker already removed) of the form {@code <KEYWORD> <argument>}.
     */
    public static Optional<CommentDirective> match(String content) {
        return Arrays.stream(values())
                .filter(d -> content.startsWith(d.keyword)
                        && content.length() > d.keyword.length()
                        && Character.isWhitespace(content.charAt(d.keyword.length()))
                        && !content.substring(d.keyword.length()).isBlank())
                .findFirst();
    }

    public String argumentOf(String content) {
        return content.substring(keyword.length()).strip();
    }
}
