package io.github.manjago.mutagen.exec;

import java.util.List;
import java.util.Map;

/**
 * Source of date x symbol series for strategy evaluation.
 */
public interface MarketData {

    /**
     * Series for a dataset key such as {@code price:close}.
     *
     * @throws EvaluationException for keys the provider cannot serve
     */
    Frame get(String key);

    /**
     * Technical indicator computed over closing prices.
     *
     * @param params indicator parameters, e.g. {@code timeperiod}
     */
    Frame indicator(String name, Map<String, Object> params);

    List<String> symbols();

    int days();
}
