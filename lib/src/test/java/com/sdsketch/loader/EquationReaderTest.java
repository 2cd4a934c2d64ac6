package com.sdsketch.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sdsketch.model.Dependency;
import com.sdsketch.model.Equation;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EquationReaderTest {

    @Test
    void readsNameDependenciesUnitsAndDescription() {
        List<LoaderMessage> messages = new ArrayList<>();
        List<Equation> equations = new EquationReader(messages).read(
                "test.mdl",
                String.join(
                        "\n",
                        "{UTF-8}",
                        "Core Developer  = A FUNCTION OF( Joining Rate,-Leaving Rate)",
                        "\t~\tPeople",
                        "\t~\tDevelopers with commit rights.",
                        "\t|",
                        ""));
        assertEquals(1, equations.size());
        Equation equation = equations.get(0);
        assertEquals("Core Developer", equation.getName());
        assertEquals("People", equation.getUnits());
        assertEquals("Developers with commit rights.", equation.getDescription());
        assertEquals(
                List.of(new Dependency("Joining Rate", false), new Dependency("Leaving Rate", true)),
                equation.getDependencies());
        assertTrue(messages.isEmpty());
    }

    @Test
    void collapsesContinuationLines() {
        List<Equation> equations = new EquationReader(new ArrayList<>()).read(
                "test.mdl",
                "Joining Rate  = A FUNCTION OF( Attractiveness,\\\n\t\tPotential Contributors)\n\t~\t\n\t~\t\t|\n");
        assertEquals("A FUNCTION OF( Attractiveness, Potential Contributors)", equations.get(0).getExpression());
        assertEquals(2, equations.get(0).getDependencies().size());
        assertEquals("Potential Contributors", equations.get(0).getDependencies().get(1).getName());
    }

    @Test
    void quotedDependencyNamesKeepCommasAndParentheses() {
        List<Dependency> dependencies =
                EquationReader.parseFunctionOf("A FUNCTION OF( -\"Workload, Peak (max)\",+Staff)");
        assertEquals(List.of(new Dependency("Workload, Peak (max)", true), new Dependency("Staff", false)), dependencies);
    }

    @Test
    void unbalancedArgumentListIsReportedNotFatal() {
        List<LoaderMessage> messages = new ArrayList<>();
        List<Equation> equations =
                new EquationReader(messages).read("test.mdl", "Broken  = A FUNCTION OF( a,b\n\t~\t\n\t~\t\t|\n");
        assertEquals(1, equations.size());
        assertTrue(equations.get(0).getDependencies().isEmpty());
        assertEquals(1, messages.size());
        assertEquals(LoaderMessage.Level.WARNING, messages.get(0).getLevel());
        assertNull(EquationReader.parseFunctionOf("A FUNCTION OF( a"));
    }

    @Test
    void skipsControlBannerAndKeepsOrdinaryExpressions() {
        String text = String.join(
                "\n",
                "********************************************************",
                "\t.Control",
                "********************************************************~",
                "\t\tSimulation Control Parameters",
                "\t|",
                "",
                "TIME STEP  = 1",
                "\t~\tMonth [0,?]",
                "\t~\tThe time step for the simulation.",
                "\t|",
                "");
        List<Equation> equations = new EquationReader(new ArrayList<>()).read("test.mdl", text);
        assertEquals(1, equations.size());
        assertEquals("TIME STEP", equations.get(0).getName());
        assertEquals("1", equations.get(0).getExpression());
        assertEquals("Month [0,?]", equations.get(0).getUnits());
        assertTrue(equations.get(0).getDependencies().isEmpty());
    }
}
