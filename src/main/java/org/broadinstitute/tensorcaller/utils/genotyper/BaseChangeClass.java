package org.broadinstitute.tensorcaller.utils.genotyper;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.tensorcaller.utils.Utils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The 21 base-change classes a genotyping classifier scores at a candidate site, in the order of its output vector.
 *
 * A class describes the pair of alleles present at the site: two bases (homozygous when equal), a base and an
 * indel, or two indels. Labels combine single-base alleles as their base letter and indel alleles as {@code Ins} or
 * {@code Del}, e.g. {@code AC}, {@code GIns}, {@code InsDel}.
 */
public enum BaseChangeClass {
    AA, AC, AG, AT, CC, CG, CT, GG, GT, TT,
    DelDel, ADel, CDel, GDel, TDel,
    InsIns, AIns, CIns, GIns, TIns,
    InsDel;

    public static final int NUMBER_OF_CLASSES = values().length;

    public static final String INSERTION_LABEL = "Ins";
    public static final String DELETION_LABEL = "Del";

    /** Homozygous single-base classes, in classifier order. */
    public static final List<BaseChangeClass> HOMOZYGOUS_SNP_CLASSES = ImmutableList.of(AA, CC, GG, TT);

    /** Heterozygous single-base classes, in classifier order. */
    public static final List<BaseChangeClass> HETEROZYGOUS_SNP_CLASSES = ImmutableList.of(AC, AG, AT, CG, CT, GT);

    /** A base on one haplotype and an insertion on the other, in classifier order. */
    public static final List<BaseChangeClass> BASE_AND_INSERTION_CLASSES = ImmutableList.of(AIns, CIns, GIns, TIns);

    /** A base on one haplotype and a deletion on the other, in classifier order. */
    public static final List<BaseChangeClass> BASE_AND_DELETION_CLASSES = ImmutableList.of(ADel, CDel, GDel, TDel);

    private static final Map<String, BaseChangeClass> byLabel = new HashMap<>();
    static {
        for (final BaseChangeClass baseChange : values()) {
            byLabel.put(baseChange.getLabel(), baseChange);
        }
    }

    public String getLabel() {
        return name();
    }

    /**
     * @return the first allele's base for single-base and base-plus-indel classes
     * @throws IllegalStateException for indel-only classes
     */
    public char getFirstBase() {
        Utils.validate(this != DelDel && this != InsIns && this != InsDel, () -> this + " has no single-base allele");
        return name().charAt(0);
    }

    /**
     * @return the second allele's base for single-base classes
     * @throws IllegalStateException for any class involving an indel
     */
    public char getSecondBase() {
        Utils.validate(ordinal() < DelDel.ordinal(), () -> this + " is not a single-base class");
        return name().charAt(1);
    }

    /**
     * @return the class with the given label, or {@code null} if there is none
     */
    public static BaseChangeClass fromLabel(final String label) {
        return label == null ? null : byLabel.get(label);
    }

    /**
     * @return the homozygous class for {@code base} ({@code AA} for 'A' and so on), or {@code null} for anything
     * that is not one of ACGT
     */
    public static BaseChangeClass homozygousClassOf(final char base) {
        return fromLabel(String.valueOf(base) + base);
    }

    /**
     * Describes one allele relative to the reference allele: {@code Del} when it is shorter, {@code Ins} when it is
     * longer, and its first base otherwise.
     */
    public static String partialLabel(final String referenceAllele, final String alternateAllele) {
        Utils.nonEmpty(referenceAllele, "reference allele");
        Utils.nonEmpty(alternateAllele, "alternate allele");
        if (referenceAllele.length() > alternateAllele.length()) {
            return DELETION_LABEL;
        } else if (referenceAllele.length() < alternateAllele.length()) {
            return INSERTION_LABEL;
        }
        return alternateAllele.substring(0, 1);
    }

    /**
     * Combines the partial labels of the two alleles of a diploid call into a full class label.
     * Single bases are sorted, a base always precedes an indel, and an insertion paired with a deletion is
     * {@code InsDel}.
     */
    public static String mixPartialLabels(final String label1, final String label2) {
        Utils.nonEmpty(label1, "label1");
        Utils.nonEmpty(label2, "label2");
        final boolean isBase1 = label1.length() == 1;
        final boolean isBase2 = label2.length() == 1;
        if (isBase1 && isBase2) {
            return label1.compareTo(label2) <= 0 ? label1 + label2 : label2 + label1;
        }
        if (isBase1) {
            return label1 + label2;
        }
        if (isBase2) {
            return label2 + label1;
        }
        if (label1.equals(label2)) {
            return label1 + label2;
        }
        return InsDel.getLabel();
    }

    /**
     * Derives the class of a diploid call from its literal alleles.
     *
     * @return the class, or {@code null} if the alleles do not describe one of the 21 classes (e.g. a non-ACGT base)
     */
    public static BaseChangeClass fromAlleles(final String referenceAllele, final String allele1, final String allele2) {
        return fromLabel(mixPartialLabels(partialLabel(referenceAllele, allele1), partialLabel(referenceAllele, allele2)));
    }
}
