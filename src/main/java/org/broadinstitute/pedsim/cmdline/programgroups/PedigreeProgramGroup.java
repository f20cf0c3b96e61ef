package org.broadinstitute.pedsim.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Program group for tools that read and resolve pedigree definitions
 */
public class PedigreeProgramGroup implements CommandLineProgramGroup {
    public static final String NAME = "Pedigree Definitions";
    public static final String SUMMARY = "Tools that read, check and resolve pedigree def files";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return SUMMARY;
    }
}
