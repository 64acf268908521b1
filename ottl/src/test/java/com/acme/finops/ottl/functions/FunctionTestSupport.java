package com.acme.finops.ottl.functions;

import com.acme.finops.ottl.ExecContext;
import com.acme.finops.ottl.Parser;
import com.acme.finops.ottl.contexts.LogContext;
import com.acme.finops.ottl.pdata.InstrumentationScope;
import com.acme.finops.ottl.pdata.LogRecord;
import com.acme.finops.ottl.pdata.Resource;

final class FunctionTestSupport {
    static final Parser<LogContext> PARSER = LogContext.newParser(StandardFunctions.all());

    private FunctionTestSupport() {
    }

    static LogContext newLog() {
        return new LogContext(new LogRecord(""), new InstrumentationScope(), new Resource());
    }

    static void run(LogContext ctx, String statement) throws Exception {
        PARSER.parseStatement(statement).execute(ExecContext.background(), ctx);
    }

    static Object eval(String expression) throws Exception {
        return eval(ExecContext.background(), newLog(), expression);
    }

    static Object eval(ExecContext exec, LogContext ctx, String expression) throws Exception {
        return PARSER.parseValueExpression(expression).eval(exec, ctx);
    }
}
