/*
 * PhrasalDB — Measure-Level Phrase Structure Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.phrasaldb.core.form;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One group ordinal per measure. Comparison works on ordinals; letters are only
 * produced by {@link #render()} and {@link #labels()}.
 *
 * <p>Rendering concatenates labels while every label is a single letter, e.g.
 * {@code AABA}. Once a form needs more than 26 labels it is rendered with a single
 * space between labels ({@code A B .. Z AA}) so it can still be split back.</p>
 */
public final class FormString {

    private static final FormString EMPTY = new FormString(new int[0]);

    private final int[] ordinals;

    private FormString(int[] ordinals) {
        this.ordinals = ordinals;
    }

    public static FormString empty() {
        return EMPTY;
    }

    public static FormString of(int... ordinals) {
        for (int ordinal : ordinals) {
            if (ordinal < 0) throw new IllegalArgumentException("Negative label ordinal: " + ordinal);
        }
        return new FormString(ordinals.clone());
    }

    /** Parses a rendered form, either concatenated letters or space-separated labels. */
    public static FormString parse(String rendered) {
        String trimmed = rendered.trim();
        if (trimmed.isEmpty()) return EMPTY;
        String[] tokens = trimmed.contains(" ") ? trimmed.split(" +") : trimmed.split("");
        return new FormString(Arrays.stream(tokens).mapToInt(LabelAlphabet::ordinal).toArray());
    }

    public int length() {
        return ordinals.length;
    }

    public boolean isEmpty() {
        return ordinals.length == 0;
    }

    public int ordinalAt(int measureIndex) {
        return ordinals[measureIndex];
    }

    public String labelAt(int measureIndex) {
        return LabelAlphabet.label(ordinals[measureIndex]);
    }

    public List<String> labels() {
        return Arrays.stream(ordinals).mapToObj(LabelAlphabet::label).collect(Collectors.toUnmodifiableList());
    }

    public int distinctLabels() {
        return (int) Arrays.stream(ordinals).distinct().count();
    }

    public String render() {
        boolean compact = Arrays.stream(ordinals).allMatch(LabelAlphabet::isSingleLetter);
        return String.join(compact ? "" : " ", labels());
    }

    /** Runs of equal labels, left to right. */
    public List<Section> sections() {
        if (ordinals.length == 0) return List.of();
        List<Section> sections = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= ordinals.length; i++) {
            if (i == ordinals.length || ordinals[i] != ordinals[i - 1]) {
                sections.add(new Section(LabelAlphabet.label(ordinals[start]), start + 1, i, i - start));
                start = i;
            }
        }
        return Collections.unmodifiableList(sections);
    }

    /** Form with consecutive duplicate labels collapsed, e.g. {@code AABBA} gives {@code ABA}. */
    public FormString collapsed() {
        return new FormString(sections().stream().mapToInt(s -> LabelAlphabet.ordinal(s.label())).toArray());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FormString other && Arrays.equals(other.ordinals, ordinals);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(ordinals);
    }

    @Override
    public String toString() {
        return render();
    }
}
