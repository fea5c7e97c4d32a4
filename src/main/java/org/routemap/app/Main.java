package org.routemap.app;

import lombok.extern.slf4j.Slf4j;
import org.routemap.core.RouteMapException;
import org.routemap.network.EdgeListParser;
import org.routemap.network.TransitNetwork;
import org.routemap.routing.core.DistancePolicy;
import org.routemap.routing.core.RouteQueryEngine;
import org.routemap.routing.core.RouteQueryService;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point: loads an edge list and prints the standard set of answers.
 */
@Slf4j
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    /**
     * @param args a single argument, the path of the edge-list file.
     */
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args == null || args.length != 1) {
            err.println("usage: routemap <edge-list-file>");
            return EXIT_USAGE;
        }
        Path input = Path.of(args[0]);
        try {
            TransitNetwork network = new EdgeListParser().parse(input);
            List<String> answers = standardAnswers(new RouteQueryEngine(network));
            for (int i = 0; i < answers.size(); i++) {
                out.println("Output #" + (i + 1) + ": " + answers.get(i));
            }
            return EXIT_OK;
        } catch (IOException ex) {
            log.error("Cannot read {}", input, ex);
            err.println("cannot read " + input + ": " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (RouteMapException ex) {
            log.error("Query failed: {}", ex.getMessage());
            err.println(ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    static List<String> standardAnswers(RouteQueryService routes) {
        List<String> answers = new ArrayList<>();
        answers.add(routes.routeLength("A-B-C").toString());
        answers.add(routes.routeLength("A-D").toString());
        answers.add(routes.routeLength("A-D-C").toString());
        answers.add(routes.routeLength("A-E-B-C-D").toString());
        answers.add(routes.routeLength("A-E-D").toString());
        answers.add(Integer.toString(routes.countRoutes("C", "C", 3, DistancePolicy.MAX_STOPS)));
        answers.add(Integer.toString(routes.countRoutes("A", "C", 4, DistancePolicy.EXACT_STOPS)));
        answers.add(routes.shortestRoute("A", "C").toString());
        answers.add(routes.shortestRoute("B", "B").toString());
        // distance strictly below 30
        answers.add(Integer.toString(routes.countRoutes("C", "C", 29, DistancePolicy.MAX_DISTANCE)));
        return answers;
    }
}
