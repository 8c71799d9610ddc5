package org.broadinstitute.fusionworkbook.tools.fusion.reference;

import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentity;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.Objects;
import java.util.Optional;

/**
 * A curated-database row: a known fusion, the database that documents it and an optional annotation.
 */
public final class ReferenceEntry {

    private final FusionIdentity identity;
    private final String provenance;
    private final String annotation;

    public ReferenceEntry(final FusionIdentity identity, final String provenance, final String annotation) {
        this.identity = Utils.nonNull(identity);
        this.provenance = Utils.nonEmpty(provenance, "the provenance cannot be empty");
        this.annotation = annotation;
    }

    public FusionIdentity getIdentity() {
        return identity;
    }

    /**
     * @return the curated source, e.g. {@code COSMIC}.
     */
    public String getProvenance() {
        return provenance;
    }

    public Optional<String> getAnnotation() {
        return Optional.ofNullable(annotation);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final ReferenceEntry that = (ReferenceEntry) o;
        return identity.equals(that.identity) && provenance.equals(that.provenance) && Objects.equals(annotation, that.annotation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, provenance, annotation);
    }

    @Override
    public String toString() {
        return identity.getName() + "@" + provenance;
    }
}
