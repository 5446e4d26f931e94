package edu.stanford.futuredata.tallyserve.parser;

import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Expression;
import edu.stanford.futuredata.tallyserve.expression.Value;
import org.javatuples.Pair;

public interface QueryParser {
    /*
     Turns query text into expression trees.  Every method throws SyntaxErrorException on malformed input.
     */

    // Parse a predicate.
    Expression parse(String text);
    // Parse "<column> [WHERE <predicate>]", the target and filter of an extent query.
    // Without WHERE the filter is "<column> IS NOT NULL".
    Pair<Column, Expression> parseExtent(String text);
    // Parse a single literal.
    Value parseLiteral(String text);
}
