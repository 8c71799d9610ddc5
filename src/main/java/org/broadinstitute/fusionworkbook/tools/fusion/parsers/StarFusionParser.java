package org.broadinstitute.fusionworkbook.tools.fusion.parsers;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.tools.fusion.*;
import org.broadinstitute.fusionworkbook.utils.Utils;
import org.broadinstitute.fusionworkbook.utils.tsv.DataLine;

import java.io.IOException;
import java.io.Reader;
import java.util.List;

/**
 * Parses STAR-Fusion {@code fusion_predictions.abridged.tsv} files.
 * <p>
 * The gene pair comes from {@code #FusionName} ({@code GENE1--GENE2}); breakpoints are {@code chr:pos:strand}.
 * The specimen is taken from the file name.
 * </p>
 */
public class StarFusionParser implements SourceParser<FusionCall> {

    public static final String FUSION_NAME_COLUMN = "#FusionName";
    public static final String JUNCTION_READ_COUNT_COLUMN = "JunctionReadCount";
    public static final String SPANNING_FRAG_COUNT_COLUMN = "SpanningFragCount";
    public static final String LEFT_BREAKPOINT_COLUMN = "LeftBreakpoint";
    public static final String RIGHT_BREAKPOINT_COLUMN = "RightBreakpoint";
    public static final String FFPM_COLUMN = "FFPM";
    public static final String SPLICE_TYPE_COLUMN = "SpliceType";
    public static final String LARGE_ANCHOR_SUPPORT_COLUMN = "LargeAnchorSupport";
    public static final String PROT_FUSION_TYPE_COLUMN = "PROT_FUSION_TYPE";
    public static final String ANNOTS_COLUMN = "annots";

    public static final List<String> REQUIRED_COLUMNS = ImmutableList.of(
            FUSION_NAME_COLUMN, JUNCTION_READ_COUNT_COLUMN, SPANNING_FRAG_COUNT_COLUMN,
            LEFT_BREAKPOINT_COLUMN, RIGHT_BREAKPOINT_COLUMN);

    private static final List<String> FLAG_COLUMNS = ImmutableList.of(LARGE_ANCHOR_SUPPORT_COLUMN, ANNOTS_COLUMN);

    private final FusionSource source;
    private final FusionIdentityNormalizer normalizer;
    private final boolean allowEmpty;

    public StarFusionParser(final FusionIdentityNormalizer normalizer, final boolean allowEmpty) {
        this(FusionSource.STAR_FUSION, normalizer, allowEmpty);
    }

    /**
     * For tools that write the STAR-Fusion layout.
     */
    protected StarFusionParser(final FusionSource source, final FusionIdentityNormalizer normalizer, final boolean allowEmpty) {
        this.source = Utils.nonNull(source);
        this.normalizer = Utils.nonNull(normalizer);
        this.allowEmpty = allowEmpty;
    }

    public FusionSource getSource() {
        return source;
    }

    @Override
    public String getSourceType() {
        return source.getDisplayName();
    }

    @Override
    public ParseResult<FusionCall> parse(final String fileName, final Reader reader) throws IOException {
        return new StarFusionTableReader(fileName, reader).readAll(allowEmpty);
    }

    /**
     * Splits a {@code GENE1--GENE2} name in caller order.
     */
    static String[] splitFusionName(final String fusionName) {
        final String[] genes = StringUtils.splitByWholeSeparatorPreserveAllTokens(fusionName, FusionIdentity.NAME_SEPARATOR);
        if (genes.length != 2) {
            throw new UserException.MalformedFusionIdentity("'" + fusionName + "' is not of the form GENE1" + FusionIdentity.NAME_SEPARATOR + "GENE2");
        }
        return genes;
    }

    private final class StarFusionTableReader extends SourceTableReader<FusionCall> {

        private final String specimen;

        StarFusionTableReader(final String fileName, final Reader reader) throws IOException {
            super(source.getDisplayName(), fileName, reader);
            this.specimen = SpecimenNames.specimenOf(fileName).orElse(null);
        }

        @Override
        protected List<String> requiredColumns() {
            return REQUIRED_COLUMNS;
        }

        @Override
        protected FusionCall parseRow(final DataLine dataLine) {
            final String fusionName = requiredText(dataLine, FUSION_NAME_COLUMN);
            final String[] genes = splitFusionName(fusionName);
            final Breakpoint left = Breakpoint.parse(dataLine.get(LEFT_BREAKPOINT_COLUMN));
            final Breakpoint right = Breakpoint.parse(dataLine.get(RIGHT_BREAKPOINT_COLUMN));
            final FusionCall.Builder builder = FusionCall.builder(normalizer.normalize(genes[0], genes[1], left, right), source)
                    .location(getSource(), dataLine.getLineNumber())
                    .specimen(specimen)
                    .displayName(fusionName)
                    .breakpoints(left, right)
                    .junctionReadCount(count(dataLine, JUNCTION_READ_COUNT_COLUMN))
                    .spanningFragmentCount(count(dataLine, SPANNING_FRAG_COUNT_COLUMN))
                    .spliceType(optionalText(dataLine, SPLICE_TYPE_COLUMN))
                    .frame(optionalText(dataLine, PROT_FUSION_TYPE_COLUMN));
            final Double ffpm = optionalDouble(dataLine, FFPM_COLUMN);
            if (ffpm != null) {
                builder.ffpm(ffpm);
            }
            for (final String flag : FLAG_COLUMNS) {
                final String value = optionalText(dataLine, flag);
                if (value != null) {
                    builder.flag(flag, value);
                }
            }
            return builder.build();
        }
    }
}
