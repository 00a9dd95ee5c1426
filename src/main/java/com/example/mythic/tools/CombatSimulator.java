package com.example.mythic.tools;

import com.example.mythic.combat.AdvanceResult;
import com.example.mythic.combat.CombatEngine;
import com.example.mythic.model.ActionEvent;
import com.example.mythic.model.Combatant;
import com.example.mythic.persistence.InMemoryCombatStore;
import com.example.mythic.util.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Runs a YAML encounter against an in-memory store and prints the event log.
 *
 * Usage: CombatSimulator [scenario.yaml] [maxSteps]
 * Without arguments the bundled /scenarios/ashen_warden.yaml is used. Resolution stops
 * when combat ends or a player has to act.
 */
public class CombatSimulator {
    private static final Logger logger = LoggerFactory.getLogger(CombatSimulator.class);

    static final String DEFAULT_SCENARIO = "/scenarios/ashen_warden.yaml";
    private static final int MAX_CALLS = 200;

    public static void main(String[] args) throws Exception {
        InMemoryCombatStore store = new InMemoryCombatStore();
        Clock clock = Clock.systemUTC();
        ScenarioLoader.Scenario scenario;
        if (args.length > 0) {
            try (InputStream in = Files.newInputStream(Path.of(args[0]))) {
                scenario = ScenarioLoader.load(in, store, clock.instant());
            }
        } else {
            scenario = ScenarioLoader.loadResource(DEFAULT_SCENARIO, store, clock.instant());
        }
        EngineConfig config = EngineConfig.load();
        int maxSteps = args.length > 1 ? Integer.parseInt(args[1]) : config.getMaxStepsCap();

        AdvanceResult last = run(new CombatEngine(store, config, clock), scenario, maxSteps);
        for (ActionEvent e : store.getEvents(scenario.combatSessionId())) {
            System.out.printf("#%-4d turn %-3d %-16s %-10s %s%n", e.getId(), e.getTurnIndex(),
                e.getType().getKey(), e.getActorCombatantId() == null ? "-" : e.getActorCombatantId(), e.getPayloadJson());
        }
        for (Combatant c : store.getCombatants(scenario.combatSessionId())) {
            System.out.printf("%-12s hp %d/%d armor %d %s%n", c.getId(), c.getHp(), c.getHpMax(), c.getArmor(),
                c.isAlive() ? "" : "(dead)");
        }
        System.out.println(last);
    }

    /**
     * Advance until the session ends, a player must act, or the call limit is hit.
     */
    public static AdvanceResult run(CombatEngine engine, ScenarioLoader.Scenario scenario, int maxSteps) {
        AdvanceResult result = null;
        for (int call = 0; call < MAX_CALLS; call++) {
            result = engine.advance(scenario.campaignId(), scenario.combatSessionId(), maxSteps);
            if (result.isEnded() || result.isRequiresPlayerAction()) {
                break;
            }
        }
        logger.info("[CombatSimulator] Stopped at {}", result);
        return result;
    }
}
