package org.belief.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.belief.formula.MalformedFormulaException;

/**
 * Trasforma il primo errore lessicale o sintattico in {@link MalformedFormulaException},
 * al posto del recupero con stampa su stderr di ANTLR.
 */
final class SyntaxErrorListener extends BaseErrorListener {

    static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

    private SyntaxErrorListener() {
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        throw new MalformedFormulaException(
                String.format("Errore di sintassi alla posizione %d:%d - %s", line, charPositionInLine, msg), e);
    }
}
