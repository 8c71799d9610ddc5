package org.broadinstitute.fusionworkbook.tools.fusion.engine;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionSource;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.nio.file.Path;
import java.util.*;

/**
 * The local files of one run. The reference files are optional; a missing one is an empty lookup.
 */
public final class FusionWorkbookInputs {

    private final String projectName;
    private final Map<FusionSource, ImmutableList<Path>> callFiles;
    private final ImmutableList<Path> qcFiles;
    private final Path historicalCallsFile;
    private final Path referenceSourcesFile;
    private final Path previousPositivesFile;

    private FusionWorkbookInputs(final Builder builder) {
        this.projectName = Utils.nonEmpty(builder.projectName, "the project name cannot be empty");
        final Map<FusionSource, ImmutableList<Path>> files = new EnumMap<>(FusionSource.class);
        builder.callFiles.forEach((source, paths) -> files.put(source, ImmutableList.copyOf(paths)));
        this.callFiles = Collections.unmodifiableMap(files);
        this.qcFiles = ImmutableList.copyOf(builder.qcFiles);
        this.historicalCallsFile = builder.historicalCallsFile;
        this.referenceSourcesFile = builder.referenceSourcesFile;
        this.previousPositivesFile = builder.previousPositivesFile;
    }

    public static Builder builder(final String projectName) {
        return new Builder(projectName);
    }

    public String getProjectName() {
        return projectName;
    }

    /**
     * @return the fusion call files of {@code source} in the order they were added, possibly none.
     */
    public ImmutableList<Path> getCallFiles(final FusionSource source) {
        return callFiles.getOrDefault(Utils.nonNull(source), ImmutableList.of());
    }

    public ImmutableList<Path> getQCFiles() {
        return qcFiles;
    }

    public Optional<Path> getHistoricalCallsFile() {
        return Optional.ofNullable(historicalCallsFile);
    }

    public Optional<Path> getReferenceSourcesFile() {
        return Optional.ofNullable(referenceSourcesFile);
    }

    public Optional<Path> getPreviousPositivesFile() {
        return Optional.ofNullable(previousPositivesFile);
    }

    public static final class Builder {
        private final String projectName;
        private final Map<FusionSource, List<Path>> callFiles = new EnumMap<>(FusionSource.class);
        private final List<Path> qcFiles = new ArrayList<>();
        private Path historicalCallsFile;
        private Path referenceSourcesFile;
        private Path previousPositivesFile;

        private Builder(final String projectName) {
            this.projectName = projectName;
        }

        public Builder callFiles(final FusionSource source, final Collection<Path> files) {
            Utils.nonNull(source, "the source cannot be null");
            Utils.containsNoNull(Utils.nonNull(files), "call files cannot be null");
            callFiles.computeIfAbsent(source, k -> new ArrayList<>()).addAll(files);
            return this;
        }

        public Builder qcFiles(final Collection<Path> files) {
            Utils.containsNoNull(Utils.nonNull(files), "QC files cannot be null");
            qcFiles.addAll(files);
            return this;
        }

        public Builder historicalCalls(final Path file) {
            this.historicalCallsFile = file;
            return this;
        }

        public Builder referenceSources(final Path file) {
            this.referenceSourcesFile = file;
            return this;
        }

        public Builder previousPositives(final Path file) {
            this.previousPositivesFile = file;
            return this;
        }

        public FusionWorkbookInputs build() {
            return new FusionWorkbookInputs(this);
        }
    }
}
