package com.caseclosed.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static spark.Spark.*;

/**
 * SNEAKY GOLEM - light-cycle agent for the Case Closed arena.
 *
 * Open play grabs the biggest reachable area. When the opponent gets within a
 * column of us we run for a corridor half a board away, then sweep sideways
 * from its exit.
 */
public class Agent {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Logger LOG = LoggerFactory.getLogger(Agent.class);

    // ============================================================
    // MAIN + ROUTES
    // ============================================================

    public static void main(String[] args) {
        AgentConfig config = AgentConfig.fromEnvironment();
        AgentService service = new AgentService(config);

        port(config.port);
        get("/", (req, res) -> JSON.writeValueAsString(service.info()));
        post("/send-state", (req, res) -> JSON.writeValueAsString(service.receiveState(req.body())));
        get("/send-move", (req, res) ->
                JSON.writeValueAsString(service.move(AgentService.playerNumber(req.queryParams("player_number")))));
        post("/end", (req, res) -> JSON.writeValueAsString(service.end(req.body())));

        after((req, res) -> res.type("application/json"));

        exception(InvalidStateException.class, (e, req, res) -> {
            LOG.warn("{} {} rejected: {}", req.requestMethod(), req.pathInfo(), e.getMessage());
            res.status(400);
            res.type("application/json");
            res.body(error(e.getMessage()));
        });
        exception(Exception.class, (e, req, res) -> {
            LOG.error("{} {} failed", req.requestMethod(), req.pathInfo(), e);
            res.status(500);
            res.type("application/json");
            res.body(error("internal error"));
        });

        awaitInitialization();
        LOG.info("Starting {} ({}) on port {}...", config.agentName, config.participant, config.port);
    }

    private static String error(String message) {
        ObjectNode n = JSON.createObjectNode();
        n.put("error", message);
        return n.toString();
    }
}
