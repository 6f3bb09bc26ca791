package org.broadinstitute.tensorcaller.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that turn classifier output into variant calls.
 */
public final class VariantCallingProgramGroup implements CommandLineProgramGroup {

    public static final String NAME = "Variant Calling";
    public static final String SUMMARY = "Tools that decode genotyping classifier probabilities into variant calls";

    @Override
    public String getName() { return NAME; }

    @Override
    public String getDescription() { return SUMMARY; }
}
