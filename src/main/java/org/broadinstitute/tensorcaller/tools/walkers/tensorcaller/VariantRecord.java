package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import com.google.common.collect.ImmutableList;
import htsjdk.samtools.util.Locatable;
import htsjdk.variant.vcf.VCFConstants;
import org.broadinstitute.tensorcaller.utils.Utils;
import org.broadinstitute.tensorcaller.utils.genotyper.GenotypeClass;

import java.util.List;

/**
 * One called site, ready to be written as a VCF data line. The sample's genotype quality equals the site quality.
 */
public final class VariantRecord implements Locatable {

    public static final String LENGTH_GUESS_KEY = "LENGUESS";

    private final String contig;
    private final int position;
    private final String referenceAllele;
    private final List<String> alternateAlleles;
    private final int quality;
    private final FilterStatus filter;
    private final int lengthGuess;
    private final GenotypeClass genotype;
    private final int depth;
    private final double alleleFrequency;

    /**
     * @param position 1-based
     * @param lengthGuess length of an inferred indel allele, or 0 if no allele length was inferred
     */
    public VariantRecord(final String contig,
                         final int position,
                         final String referenceAllele,
                         final List<String> alternateAlleles,
                         final int quality,
                         final FilterStatus filter,
                         final int lengthGuess,
                         final GenotypeClass genotype,
                         final int depth,
                         final double alleleFrequency) {
        this.contig = Utils.nonEmpty(contig, "contig");
        Utils.validateArg(position > 0, "position must be 1-based");
        this.position = position;
        this.referenceAllele = Utils.nonEmpty(referenceAllele, "reference allele");
        this.alternateAlleles = ImmutableList.copyOf(Utils.nonEmpty(alternateAlleles, "alternate alleles"));
        for (final String allele : this.alternateAlleles) {
            Utils.nonEmpty(allele, "alternate allele");
        }
        Utils.validateArg(quality >= 0, "quality must not be negative");
        this.quality = quality;
        this.filter = Utils.nonNull(filter, "filter");
        this.lengthGuess = lengthGuess;
        this.genotype = Utils.nonNull(genotype, "genotype");
        this.depth = depth;
        Utils.validateArg(alleleFrequency >= 0.0 && alleleFrequency <= 1.0, () -> "allele frequency out of range: " + alleleFrequency);
        this.alleleFrequency = alleleFrequency;
    }

    @Override
    public String getContig() {
        return contig;
    }

    @Override
    public int getStart() {
        return position;
    }

    @Override
    public int getEnd() {
        return position + referenceAllele.length() - 1;
    }

    public String getReferenceAllele() {
        return referenceAllele;
    }

    public List<String> getAlternateAlleles() {
        return alternateAlleles;
    }

    /**
     * @return the ALT column: alternate alleles joined by commas
     */
    public String getAlternateAlleleField() {
        return String.join(",", alternateAlleles);
    }

    public int getQuality() {
        return quality;
    }

    public FilterStatus getFilter() {
        return filter;
    }

    public int getLengthGuess() {
        return lengthGuess;
    }

    /**
     * @return the INFO column: the inferred indel length when there is one, otherwise the missing value
     */
    public String getInfoField() {
        return lengthGuess > 0 ? LENGTH_GUESS_KEY + "=" + lengthGuess : VCFConstants.EMPTY_INFO_FIELD;
    }

    public GenotypeClass getGenotype() {
        return genotype;
    }

    public int getDepth() {
        return depth;
    }

    public double getAlleleFrequency() {
        return alleleFrequency;
    }

    @Override
    public String toString() {
        return String.format("%s:%d %s>%s %s", contig, position, referenceAllele, getAlternateAlleleField(), genotype.getGenotypeString());
    }
}
