package org.broadinstitute.fusionworkbook.tools.fusion;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.Arrays;
import java.util.Optional;

/**
 * Helpers for sample and file names of the form {@code <run>-<specimen>-<panel>-<suffix>_S33_L001_R1...}.
 */
public final class SpecimenNames {

    private static final String FIELD_SEPARATOR = "-";

    private SpecimenNames() {}

    /**
     * @return the second {@code -} separated field of the name, empty if there is none.
     */
    public static Optional<String> specimenOf(final String name) {
        Utils.nonNull(name);
        final String[] fields = StringUtils.splitPreserveAllTokens(name.trim(), FIELD_SEPARATOR);
        if (fields.length < 2 || fields[1].trim().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(fields[1].trim());
    }

    /**
     * @return the first three {@code -} separated fields, the name used for IGV sessions; the whole name if it
     * has fewer fields.
     */
    public static String igvNameOf(final String name) {
        Utils.nonNull(name);
        final String[] fields = StringUtils.splitPreserveAllTokens(name.trim(), FIELD_SEPARATOR);
        if (fields.length < 3) {
            return name.trim();
        }
        return String.join(FIELD_SEPARATOR, Arrays.copyOf(fields, 3));
    }

    /**
     * Drops the first {@code _} separated field of a project name, e.g. {@code 002_250101_PCAN} gives
     * {@code 250101_PCAN}. Names without {@code _} are returned unchanged.
     */
    public static String projectPrefixOf(final String projectName) {
        Utils.nonEmpty(projectName, "the project name cannot be empty");
        final int index = projectName.indexOf('_');
        return index < 0 || index == projectName.length() - 1 ? projectName : projectName.substring(index + 1);
    }
}
