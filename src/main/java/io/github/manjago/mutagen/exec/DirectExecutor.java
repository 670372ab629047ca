package io.github.manjago.mutagen.exec;

import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.SnippetParser;
import io.github.manjago.mutagen.snippet.SnippetSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs a strategy snippet in-process and returns its backtest report.
 *
 * <p>The snippet sees two host globals: {@code data} (see {@link DataHandle})
 * and {@code sim(position, **options)}. The result is the {@code report}
 * global when the snippet calls {@code sim} itself, otherwise the
 * {@code position} frame is backtested with default options.
 */
public final class DirectExecutor {

    private static final Logger log = LoggerFactory.getLogger(DirectExecutor.class);

    private final MarketData market;
    private final Backtester backtester;
    private final long maxSteps;

    public DirectExecutor(MarketData market, Backtester backtester, long maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
        }
        this.market = market;
        this.backtester = backtester;
        this.maxSteps = maxSteps;
    }

    /**
     * Executor over the synthetic market described by the config.
     */
    public static DirectExecutor fromConfig(MutagenConfig config) {
        MarketData market = new SyntheticMarketData(config.market());
        return new DirectExecutor(market, new SimpleBacktester(market), config.sandbox().maxSteps());
    }

    public MarketData market() {
        return market;
    }

    /**
     * @throws SnippetSyntaxException when the code does not parse
     * @throws EvaluationException on any runtime failure, including budget exhaustion
     */
    public BacktestReport run(String code, Duration timeout) throws SnippetSyntaxException {
        Script script = SnippetParser.parse(code);
        ExecutionBudget budget = new ExecutionBudget(maxSteps, timeout);
        Interpreter interpreter = new Interpreter(budget, Map.of(
            "data", new DataHandle(market),
            "sim", new BuiltinFunction("sim", (interp, args, kwargs) -> simulate(args, kwargs))));
        interpreter.run(script);

        Object report = interpreter.global("report");
        if (report instanceof BacktestReport r) {
            log.debug("Snippet produced its own report in {} steps", budget.getSteps());
            return r;
        }
        Object position = interpreter.global("position");
        if (position instanceof Frame frame) {
            return backtester.run(frame, BacktestOptions.DEFAULTS);
        }
        throw new EvaluationException("Snippet defined neither 'report' nor a 'position' frame");
    }

    private BacktestReport simulate(List<Object> args, Map<String, Object> kwargs) {
        Object position = Builtins.arg(args, kwargs, 0, "position");
        if (!(position instanceof Frame frame)) {
            throw new EvaluationException("sim() expects a position Frame, got " + Operators.typeName(position));
        }
        return backtester.run(frame, BacktestOptions.fromArguments(kwargs));
    }
}
