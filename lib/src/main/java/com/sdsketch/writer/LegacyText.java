package com.sdsketch.writer;

import java.util.List;

/** Fixed text fragments the authoring tool expects around the generated records. */
public final class LegacyText {
    public static final String ENCODING_HEADER = "{UTF-8}";

    public static final List<String> VIEW_HEADER = List.of(
            "V300  Do not put anything below this section - it will be ignored",
            "*View 1",
            "$-1--1--1,0,|12||-1--1--1|-1--1--1|-1--1--1|-1--1--1|-1--1--1|96,96,67,2");

    public static final List<String> FOOTER = List.of(":L<%^E!@", "5:Time", "19:67,0", "24:0", "25:0", "26:0");

    public static final String CONTROL_BLOCK =
            "********************************************************\n"
                    + "\t.Control\n"
                    + "********************************************************~\n"
                    + "\t\tSimulation Control Parameters\n"
                    + "\t|\n\n"
                    + "FINAL TIME  = 100\n"
                    + "\t~\tMonth\n"
                    + "\t~\tThe final time for the simulation.\n"
                    + "\t|\n\n"
                    + "INITIAL TIME  = 0\n"
                    + "\t~\tMonth\n"
                    + "\t~\tThe initial time for the simulation.\n"
                    + "\t|\n\n"
                    + "SAVEPER  = \n"
                    + "        TIME STEP\n"
                    + "\t~\tMonth [0,?]\n"
                    + "\t~\tThe frequency with which output is stored.\n"
                    + "\t|\n\n"
                    + "TIME STEP  = 1\n"
                    + "\t~\tMonth [0,?]\n"
                    + "\t~\tThe time step for the simulation.\n"
                    + "\t|\n\n";

    private LegacyText() {}

    /**
     * One {@code A FUNCTION OF} equation block including its trailing blank line, terminated with
     * {@code \n}.
     */
    public static String equationBlock(String quotedName, String dependencies, String units, String description) {
        return quotedName + "  = A FUNCTION OF( " + dependencies + ")\n"
                + "\t~\t" + units + "\n"
                + "\t~\t" + description + "\t|\n\n";
    }
}
