package org.broadinstitute.tensorcaller.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;

/**
 * Configuration file for the variant decoding engine.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is always resolved "top-down" by declaration order in the @Sources annotation.
 *
 * In this case, the load order is:
 *        1)   "file:${" + TensorCallerConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "file:TensorCallerConfig.properties",
 *        3)   "classpath:org/broadinstitute/tensorcaller/utils/config/TensorCallerConfig.properties"
 *        4)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + TensorCallerConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",                      // Variable for file loading
        "file:TensorCallerConfig.properties",                                                     // Default path
        "classpath:org/broadinstitute/tensorcaller/utils/config/TensorCallerConfig.properties"    // Class path
})
public interface TensorCallerConfig extends Accessible {

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link TensorCallerConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "TensorCallerConfig.pathToConfig";

    // ----------------------------------------------------------
    // Evidence window:
    // ----------------------------------------------------------

    /** Number of reference bases on each side of the candidate position in the evidence window. */
    @Key("flanking_base_number")
    @DefaultValue("16")
    int flanking_base_number();

    /** Largest indel length the classifier's length vectors can express. */
    @Key("maximum_variant_length")
    @DefaultValue("16")
    int maximum_variant_length();

    // ----------------------------------------------------------
    // Indel allele recovery:
    // ----------------------------------------------------------

    @Key("minimum_variant_length_that_needs_inference")
    @DefaultValue("16")
    int minimum_variant_length_that_needs_inference();

    @Key("maximum_variant_length_that_needs_inference")
    @DefaultValue("50")
    int maximum_variant_length_that_needs_inference();

    /** Indel support at an offset, relative to reference support, needed to keep extending an inferred indel. */
    @Key("inferred_indel_length_minimum_allele_frequency")
    @DefaultValue("0.125")
    double inferred_indel_length_minimum_allele_frequency();

    // ----------------------------------------------------------
    // Alignment pileup:
    // ----------------------------------------------------------

    @Key("pileup_max_depth")
    @DefaultValue("250")
    int pileup_max_depth();

    /** Reads carrying any of these SAM flags are excluded from the pileup (unmapped, secondary, supplementary). */
    @Key("pileup_flag_filter")
    @DefaultValue("2308")
    int pileup_flag_filter();

    // ----------------------------------------------------------
    // Pipeline:
    // ----------------------------------------------------------

    @Key("prediction_batch_size")
    @DefaultValue("1000")
    int prediction_batch_size();

    @Key("progress_seconds_between_updates")
    @DefaultValue("10.0")
    double progress_seconds_between_updates();
}
