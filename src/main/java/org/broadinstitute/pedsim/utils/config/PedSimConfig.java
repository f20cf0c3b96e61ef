package org.broadinstitute.pedsim.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;

/**
 * Toolkit options.  Sources are merged, the first one defining an option wins:
 *
 *      1) Java system properties ({@code -Dcomment_marker=%})
 *      2) the file given with {@code --pedsim-config-file}
 *      3) PedSimConfig.properties in the working directory
 *      4) the PedSimConfig.properties shipped on the classpath
 *      5) the @DefaultValue of each option
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "system:properties",
        "file:${" + PedSimConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
        "file:PedSimConfig.properties",
        "classpath:org/broadinstitute/pedsim/utils/config/PedSimConfig.properties"
})
public interface PedSimConfig extends Accessible {

    /**
     * Variable holding the path given with {@code --pedsim-config-file}.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "PedSimConfig.pathToConfig";

    /**
     * Whether Main prints the stack trace of errors in the input, as well as their message.
     */
    @DefaultValue("false")
    boolean pedsim_stacktrace_on_user_exception();

    /**
     * Lines whose first token starts with this marker are ignored.
     */
    @DefaultValue("#")
    String comment_marker();

    /**
     * Whether to warn when the last generation of a pedigree has no-print branches (these branches
     * could be omitted, which may reduce the number of founders needed).
     */
    @DefaultValue("true")
    boolean warn_on_last_generation_no_print();
}
