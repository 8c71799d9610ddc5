package org.broadinstitute.fusionworkbook.tools.fusion.parsers;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.fusionworkbook.tools.fusion.*;
import org.broadinstitute.fusionworkbook.utils.Utils;
import org.broadinstitute.fusionworkbook.utils.tsv.DataLine;

import java.io.IOException;
import java.io.Reader;
import java.util.List;

/**
 * Parses Arriba {@code fusions.tsv} files.
 * <p>
 * Junction reads are the sum of {@code split_reads1} and {@code split_reads2}; spanning fragments are
 * {@code discordant_mates}. Breakpoints are {@code chr:pos}, with the strand taken from the fusion half of the
 * {@code strand(gene/fusion)} columns when it is known. {@code confidence} and {@code type} are kept as flags.
 * </p>
 */
public final class ArribaParser implements SourceParser<FusionCall> {

    public static final String GENE1_COLUMN = "#gene1";
    public static final String GENE2_COLUMN = "gene2";
    public static final String STRAND1_COLUMN = "strand1(gene/fusion)";
    public static final String STRAND2_COLUMN = "strand2(gene/fusion)";
    public static final String BREAKPOINT1_COLUMN = "breakpoint1";
    public static final String BREAKPOINT2_COLUMN = "breakpoint2";
    public static final String TYPE_COLUMN = "type";
    public static final String SPLIT_READS1_COLUMN = "split_reads1";
    public static final String SPLIT_READS2_COLUMN = "split_reads2";
    public static final String DISCORDANT_MATES_COLUMN = "discordant_mates";
    public static final String CONFIDENCE_COLUMN = "confidence";
    public static final String READING_FRAME_COLUMN = "reading_frame";

    public static final List<String> REQUIRED_COLUMNS = ImmutableList.of(
            GENE1_COLUMN, GENE2_COLUMN, BREAKPOINT1_COLUMN, BREAKPOINT2_COLUMN,
            SPLIT_READS1_COLUMN, SPLIT_READS2_COLUMN, DISCORDANT_MATES_COLUMN);

    private final FusionIdentityNormalizer normalizer;
    private final boolean allowEmpty;

    public ArribaParser(final FusionIdentityNormalizer normalizer, final boolean allowEmpty) {
        this.normalizer = Utils.nonNull(normalizer);
        this.allowEmpty = allowEmpty;
    }

    @Override
    public String getSourceType() {
        return FusionSource.ARRIBA.getDisplayName();
    }

    @Override
    public ParseResult<FusionCall> parse(final String fileName, final Reader reader) throws IOException {
        return new ArribaTableReader(fileName, reader).readAll(allowEmpty);
    }

    /**
     * @return the fusion strand of a {@code gene/fusion} strand pair such as {@code +/-}, {@code null} if unknown.
     */
    static String fusionStrand(final String strands) {
        if (strands == null) {
            return null;
        }
        final int slash = strands.indexOf('/');
        final String strand = slash < 0 ? strands : strands.substring(slash + 1);
        return "+".equals(strand) || "-".equals(strand) ? strand : null;
    }

    private final class ArribaTableReader extends SourceTableReader<FusionCall> {

        private final String specimen;

        ArribaTableReader(final String fileName, final Reader reader) throws IOException {
            super(FusionSource.ARRIBA.getDisplayName(), fileName, reader);
            this.specimen = SpecimenNames.specimenOf(fileName).orElse(null);
        }

        @Override
        protected List<String> requiredColumns() {
            return REQUIRED_COLUMNS;
        }

        @Override
        protected FusionCall parseRow(final DataLine dataLine) {
            final String gene1 = dataLine.get(GENE1_COLUMN).trim();
            final String gene2 = dataLine.get(GENE2_COLUMN).trim();
            final Breakpoint breakpoint1 = breakpoint(dataLine, BREAKPOINT1_COLUMN, STRAND1_COLUMN);
            final Breakpoint breakpoint2 = breakpoint(dataLine, BREAKPOINT2_COLUMN, STRAND2_COLUMN);
            final FusionCall.Builder builder = FusionCall.builder(normalizer.normalize(gene1, gene2, breakpoint1, breakpoint2), FusionSource.ARRIBA)
                    .location(getSource(), dataLine.getLineNumber())
                    .specimen(specimen)
                    .displayName(gene1 + FusionIdentity.NAME_SEPARATOR + gene2)
                    .breakpoints(breakpoint1, breakpoint2)
                    .junctionReadCount(count(dataLine, SPLIT_READS1_COLUMN) + count(dataLine, SPLIT_READS2_COLUMN))
                    .spanningFragmentCount(count(dataLine, DISCORDANT_MATES_COLUMN))
                    .frame(optionalText(dataLine, READING_FRAME_COLUMN));
            final String confidence = optionalText(dataLine, CONFIDENCE_COLUMN);
            if (confidence != null) {
                builder.flag(CONFIDENCE_COLUMN, confidence);
            }
            final String type = optionalText(dataLine, TYPE_COLUMN);
            if (type != null) {
                builder.flag(TYPE_COLUMN, type);
            }
            return builder.build();
        }

        private Breakpoint breakpoint(final DataLine dataLine, final String breakpointColumn, final String strandColumn) {
            final Breakpoint breakpoint = Breakpoint.parse(dataLine.get(breakpointColumn));
            final String strand = fusionStrand(optionalText(dataLine, strandColumn));
            return strand == null || breakpoint.getStrand().isPresent() ? breakpoint : breakpoint.withStrand(strand);
        }
    }
}
