package org.belief.shell;

import org.belief.base.BeliefBase;
import org.belief.parser.FormulaReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

import static org.junit.jupiter.api.Assertions.*;

class BeliefShellTest {

    private ByteArrayOutputStream buffer;
    private BeliefShell shell;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        shell = new BeliefShell(ShellConfiguration.defaults(), new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void scriptBuildsAndRevisesTheBase() throws IOException {
        run("# base iniziale\n"
                + "expand p 30\n"
                + "expand p >> q 50\n"
                + "\n"
                + "entails q\n"
                + "revise ~q 40\n"
                + "entails q\n"
                + "show\n");

        String output = output();
        assertTrue(output.contains("[I] La base implica: q"), output);
        assertTrue(output.contains("rimossa: p [radicamento: 30]"), output);
        assertTrue(output.contains("[I] La base non implica: q"), output);

        BeliefBase base = shell.getBase();
        assertEquals(List.of(
                new BeliefBase.Entry(FormulaReader.read("p >> q"), 50),
                new BeliefBase.Entry(FormulaReader.read("~q"), 40)), base.show());
    }

    @Test
    void expandWithoutEntrenchmentUsesConfiguredDefault() {
        shell.execute("expand p & q");

        assertEquals(BeliefBase.DEFAULT_ENTRENCHMENT, shell.getBase().getEntrenchment(FormulaReader.read("q & p")));
    }

    @Test
    void updateKeepsPositionAndOptionallyEntrenchment() {
        shell.execute("expand p 10");
        shell.execute("expand r 20");
        shell.execute("update p => ~p");
        shell.execute("update r => s 70");

        assertEquals(List.of(
                new BeliefBase.Entry(FormulaReader.read("~p"), 10),
                new BeliefBase.Entry(FormulaReader.read("s"), 70)), shell.getBase().show());
    }

    @Test
    void errorsArePrintedAndSessionContinues() {
        assertTrue(shell.execute("expand p &"));
        assertTrue(shell.execute("remove q"));
        assertTrue(shell.execute("contract p | ~p"));
        assertTrue(shell.execute("update p"));
        assertTrue(shell.execute("frobnicate"));

        String output = output();
        assertEquals(5, output.lines().filter(line -> line.startsWith("[E]")).count(), output);
        assertTrue(shell.getBase().isEmpty());
    }

    @Test
    void exitStopsTheScript() throws IOException {
        run("expand p\n"
                + "exit\n"
                + "expand q\n");

        assertEquals(1, shell.getBase().size());
        assertTrue(output().contains("Arrivederci!"));
        assertFalse(shell.execute("quit"));
    }

    @Test
    void reportsQueriesOnTheBase() {
        shell.execute("show");
        shell.execute("expand p");
        shell.execute("expand ~p");
        shell.execute("consistent");
        shell.execute("cnf p >> r");
        shell.execute("entrenchment ~p");
        shell.execute("explain q");

        String output = output();
        assertTrue(output.contains("La base di credenze è vuota."), output);
        assertTrue(output.contains("[I] La base è inconsistente"), output);
        assertTrue(output.contains("(~p | r)"), output);
        assertTrue(output.contains("[I] Radicamento di ~p: 50"), output);
        assertTrue(output.contains("genera []"), output);
    }

    @Test
    void contractAndClear() {
        shell.execute("expand p 10");
        shell.execute("contract q");
        shell.execute("contract p");
        shell.execute("expand q");
        shell.execute("clear");

        String output = output();
        assertTrue(output.contains("[I] La base non implica q: nessuna modifica"), output);
        assertTrue(output.contains("rimossa: p [radicamento: 10]"), output);
        assertTrue(shell.getBase().isEmpty());
    }

    @Test
    void helpListsCommands() {
        shell.execute("help");
        shell.execute("help revise");

        String output = output();
        for (String command : BeliefShell.COMMANDS.keySet()) {
            assertTrue(output.contains(command), command);
        }
        assertTrue(output.contains("revise <formula> [<radicamento>] - Revisione"), output);
    }

    @Test
    void timedOutRevisionLeavesBaseUntouchedAndShellUsable() {
        BeliefShell quick = new BeliefShell(
                new ShellConfiguration(false, null, false, 1, BeliefBase.DEFAULT_ENTRENCHMENT, true),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
        for (String clause : pigeonholeClauses(7)) {
            quick.execute("expand " + clause);
        }
        List<BeliefBase.Entry> before = quick.getBase().show();
        long modifications = quick.getBase().getModificationCount();

        assertTrue(quick.execute("revise z"));

        String output = output();
        assertTrue(output.contains("[W] Timeout raggiunto dopo 1 secondi: base invariata"), output);
        assertEquals(before, quick.getBase().show());
        assertEquals(modifications, quick.getBase().getModificationCount());

        quick.execute("expand z");
        assertTrue(quick.getBase().contains(FormulaReader.read("z")));
    }

    /**
     * n piccioni in n buchi: soddisfacibile, ma la saturazione per risoluzione
     * genera un numero enorme di clausole.
     */
    private static List<String> pigeonholeClauses(int n) {
        List<String> clauses = new ArrayList<>();
        for (int pigeon = 1; pigeon <= n; pigeon++) {
            StringJoiner somewhere = new StringJoiner(" | ");
            for (int hole = 1; hole <= n; hole++) {
                somewhere.add("p" + pigeon + "_" + hole);
            }
            clauses.add(somewhere.toString());
        }
        for (int hole = 1; hole <= n; hole++) {
            for (int first = 1; first <= n; first++) {
                for (int second = first + 1; second <= n; second++) {
                    clauses.add("~p" + first + "_" + hole + " | ~p" + second + "_" + hole);
                }
            }
        }
        return clauses;
    }

    private void run(String script) throws IOException {
        shell.run(new BufferedReader(new StringReader(script)), false);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
