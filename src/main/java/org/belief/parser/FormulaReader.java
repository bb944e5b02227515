package org.belief.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.belief.antlr.LogicFormulaLexer;
import org.belief.antlr.LogicFormulaParser;
import org.belief.formula.Formula;
import org.belief.formula.MalformedFormulaException;

/**
 * Lettura di formule in notazione infissa: Lexing → Parsing → Visitor.
 *
 * Sintassi: {@code ~f}, {@code f & g}, {@code f | g}, {@code f >> g},
 * {@code f <<>> g}, parentesi tonde, identificatori alfanumerici.
 */
public final class FormulaReader {

    private FormulaReader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param text formula in notazione infissa
     * @return albero della formula
     * @throws MalformedFormulaException se il testo è vuoto o non analizzabile
     */
    public static Formula read(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new MalformedFormulaException("Formula vuota");
        }

        CharStream input = CharStreams.fromString(text);
        LogicFormulaLexer lexer = new LogicFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        LogicFormulaParser parser = new LogicFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrorListener.INSTANCE);

        ParseTree tree = parser.formula();
        return new FormulaTreeBuilder().visit(tree);
    }
}
