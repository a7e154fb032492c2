package com.trading.calcgraph;

import com.trading.calcgraph.engine.CalcGraph;
import com.trading.calcgraph.io.JsonGraphLoader;
import com.trading.calcgraph.node.CalcNode;
import com.trading.calcgraph.util.GraphExplain;
import com.trading.calcgraph.util.NodeProfileListener;

import java.io.IOException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Prices a European option with the Black-Scholes formula.
 *
 * Market data ("vol", "spot price", "risk free rate") and the contract
 * ("option type", "time to expiry", "strike price") are loaded from
 * {@code black_scholes.json}; the formula is registered as calculated nodes.
 * "option price" reads either "call price" or "put price" depending on the
 * option type, so it only depends on the leg it last priced.
 */
public class BlackScholesDemo {
    private static final Logger log = LogManager.getLogger(BlackScholesDemo.class);

    public static final String DEFINITION = "black_scholes.json";

    public static void main(String[] args) throws IOException {
        CalcGraph graph = load();
        NodeProfileListener profile = new NodeProfileListener();
        graph.setListener(profile);

        // 1) An out of the money 2-year call option
        graph.setValue("option type", "call");
        graph.setValue("strike price", 275.0);
        graph.setValue("time to expiry", 2.0);
        log.info(String.format("1: Value of a call option is %.2f", graph.<Double>evaluate("option price")));

        // 2) As 1 but at-the-money
        graph.setValue("strike price", graph.<Double>evaluate("spot price"));
        log.info(String.format("2: Value of a call option is %.2f", graph.<Double>evaluate("option price")));

        // 3) Market data is not settable but can be overridden: double the volatility
        graph.override("vol", 2 * graph.<Double>evaluate("vol"));
        log.info(String.format("3: Value of a call option is %.2f", graph.<Double>evaluate("option price")));
        graph.removeOverride("vol");

        // 4) Same contract as a put
        graph.setValue("option type", "put");
        log.info(String.format("4: Value of a put option is %.2f", graph.<Double>evaluate("option price")));

        log.info("Dependencies:\n{}", new GraphExplain(graph).dumpDependencies());
        log.info("Profile:\n{}", profile.dump());
    }

    /** Loads the market data and registers the pricing nodes. */
    public static CalcGraph load() throws IOException {
        JsonGraphLoader loader = new JsonGraphLoader();
        CalcGraph graph = loader.compile(loader.parseResource(DEFINITION));
        registerPricing(graph);
        return graph;
    }

    /**
     * Registers d1, d2, call price, put price and option price on a graph
     * that already holds the market data and contract nodes.
     */
    public static void registerPricing(CalcGraph graph) {
        graph.register(CalcNode.<Double>of("d1", g -> {
            double s = num(g.evaluate("spot price"));
            double k = num(g.evaluate("strike price"));
            double r = num(g.evaluate("risk free rate"));
            double vol = num(g.evaluate("vol"));
            double t = num(g.evaluate("time to expiry"));
            return (Math.log(s / k) + (r + vol * vol / 2) * t) / (vol * Math.sqrt(t));
        }));

        graph.register(CalcNode.<Double>of("d2",
                g -> num(g.evaluate("d1")) - num(g.evaluate("vol")) * Math.sqrt(num(g.evaluate("time to expiry")))));

        graph.register(CalcNode.<Double>of("call price", g -> {
            double d1 = num(g.evaluate("d1"));
            double d2 = num(g.evaluate("d2"));
            double s = num(g.evaluate("spot price"));
            double k = num(g.evaluate("strike price"));
            double t = num(g.evaluate("time to expiry"));
            double r = num(g.evaluate("risk free rate"));
            return normCdf(d1) * s - normCdf(d2) * k * Math.exp(-r * t);
        }));

        graph.register(CalcNode.<Double>of("put price", g -> {
            double d1 = num(g.evaluate("d1"));
            double d2 = num(g.evaluate("d2"));
            double s = num(g.evaluate("spot price"));
            double k = num(g.evaluate("strike price"));
            double t = num(g.evaluate("time to expiry"));
            double r = num(g.evaluate("risk free rate"));
            return normCdf(-d2) * k * Math.exp(-r * t) - normCdf(-d1) * s;
        }));

        graph.register(CalcNode.<Double>of("option price", g -> {
            String type = g.evaluate("option type");
            switch (type) {
                case "call":
                    return g.evaluate("call price");
                case "put":
                    return g.evaluate("put price");
                default:
                    throw new IllegalArgumentException("Unknown option type: " + type);
            }
        }));
    }

    private static double num(Object value) {
        return ((Number) value).doubleValue();
    }

    /**
     * Standard normal CDF, Abramowitz and Stegun 7.1.26 (|error| < 7.5e-8).
     * Symmetric by construction: normCdf(-x) == 1 - normCdf(x).
     */
    static double normCdf(double x) {
        double z = Math.abs(x) / Math.sqrt(2.0);
        double t = 1.0 / (1.0 + 0.3275911 * z);
        double poly = t * (0.254829592 + t * (-0.284496736 + t * (1.421413741 + t * (-1.453152027 + t * 1.061405429))));
        double tail = 0.5 * poly * Math.exp(-z * z);
        return x >= 0 ? 1.0 - tail : tail;
    }
}
