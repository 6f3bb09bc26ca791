package org.broadinstitute.tensorcaller.tools.walkers.tensorcaller;

import org.broadinstitute.tensorcaller.engine.ProbabilityBundle;
import org.broadinstitute.tensorcaller.utils.QualityUtils;
import org.broadinstitute.tensorcaller.utils.Utils;
import org.broadinstitute.tensorcaller.utils.genotyper.BaseChangeClass;
import org.broadinstitute.tensorcaller.utils.genotyper.GenotypeClass;

import java.util.List;

/**
 * Scores a composed call. The base-change class and genotype class are derived again from the final alleles and
 * GT string rather than taken from the winning hypothesis, and the quality is that of the product of their
 * probabilities.
 */
public final class VariantQualityCalculator {

    private VariantQualityCalculator() {}

    /**
     * @param genotypeString unphased GT value of the call, e.g. {@code 0/1}
     * @return the call quality, or 0 if the GT value or the alleles do not describe a known class
     */
    public static int qualityOf(final String referenceAllele,
                                final List<String> alternateAlleles,
                                final String genotypeString,
                                final ProbabilityBundle probabilities) {
        Utils.nonEmpty(referenceAllele, "reference allele");
        Utils.nonEmpty(alternateAlleles, "alternate alleles");
        Utils.nonNull(probabilities, "probabilities");

        final GenotypeClass genotype = GenotypeClass.fromGenotypeString(genotypeString);
        if (genotype == null) {
            return 0;
        }

        final String allele1;
        final String allele2;
        if (alternateAlleles.size() == 1) {
            final boolean carriesReference = genotype == GenotypeClass.HOMOZYGOUS_REFERENCE || genotype == GenotypeClass.HETEROZYGOUS_VARIANT;
            allele1 = carriesReference ? referenceAllele : alternateAlleles.get(0);
            allele2 = alternateAlleles.get(0);
        } else {
            allele1 = alternateAlleles.get(0);
            allele2 = alternateAlleles.get(1);
        }

        final BaseChangeClass baseChange = BaseChangeClass.fromAlleles(referenceAllele, allele1, allele2);
        if (baseChange == null) {
            return 0;
        }
        final double probability = probabilities.getBaseChangeProbability(baseChange) * probabilities.getGenotypeProbability(genotype);
        return QualityUtils.callQuality(probability);
    }
}
