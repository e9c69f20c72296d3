package worldsim.simulation;

import worldsim.resolution.SkillCheck;
import worldsim.resolution.StochasticResolver;
import worldsim.world.Attributes;
import worldsim.world.Branch;
import worldsim.world.Effect;
import worldsim.world.Entity;
import worldsim.world.Interaction;
import worldsim.world.Node;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Picks and resolves one interaction for an entity.
 * <p>
 * Candidates are the entity's assigned interactions that are available this turn, whose
 * requirements the entity meets, that are offered at its node and that have at least
 * one branch open to it. Interaction and branch weights are biased by coherence; the
 * branch is then attempted with a d20 check.
 */
class InteractionResolver {

    private static final Logger logger = Logger.getLogger(InteractionResolver.class.getName());

    static final double GOAL_BONUS = 2.0;
    static final double GOLDEN_RATIO = 1.618;
    static final double GROWTH_RATE = 0.1;

    private final StochasticResolver resolver;

    InteractionResolver(StochasticResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Ability that grows with an interaction type.
     */
    static String attributeFor(String interactionType) {
        if (interactionType == null) {
            return Attributes.WISDOM;
        }
        return switch (interactionType) {
            case "dialogue" -> Attributes.CHARISMA;
            case "action" -> Attributes.STRENGTH;
            case "trade" -> Attributes.INTELLIGENCE;
            default -> Attributes.WISDOM;
        };
    }

    static double interactionWeight(Entity entity, Interaction interaction) {
        double weight = 1 + 1.5 * entity.coherence();
        if (entity.goals().contains(interaction.id())) {
            weight += GOAL_BONUS;
        }
        return weight;
    }

    static double branchWeight(Entity entity, Branch branch) {
        return branch.weight() * (1 + 0.5 * entity.coherence());
    }

    /**
     * Resolves one interaction for the entity and writes the effects to the workspace.
     *
     * @return the action taken, or empty when the entity had nothing it could do
     */
    Optional<CharacterAction> resolve(Entity entity, TurnWorkspace workspace) {
        Node node = workspace.base().node(entity.nodeId()).orElse(null);
        List<Interaction> candidates = entity.assignedInteractions().stream()
                .map(workspace.interactions::get)
                .filter(interaction -> interaction != null
                        && interaction.isAvailable(workspace.turn())
                        && interaction.meetsRequirements(entity)
                        && interaction.isOfferedAt(node)
                        && interaction.branches().stream().anyMatch(branch -> branch.isEligibleFor(entity)))
                .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        Interaction interaction = resolver.select(candidates, candidate -> interactionWeight(entity, candidate));
        List<Branch> branches = interaction.branches().stream()
                .filter(branch -> branch.isEligibleFor(entity))
                .toList();
        Branch branch = resolver.select(branches, candidate -> branchWeight(entity, candidate));

        SkillCheck check = resolver.skillCheck(List.of(entity.attributes().modifier(branch.attribute())), branch.difficulty());
        Entity updated = entity.withLastInteractionType(interaction.type());
        if (check.success()) {
            updated = applyEffects(updated, branch.effects(), workspace.resources);
            String grown = attributeFor(interaction.type());
            double growth = GROWTH_RATE * (1 + 0.5 * entity.coherence()) * GOLDEN_RATIO;
            updated = updated.withAttributes(updated.attributes().adjust(grown, growth));
            workspace.interactions.put(interaction.id(), interaction.markUsed(workspace.turn()));
        }
        workspace.entities.put(entity.id(), updated);

        CharacterAction action = new CharacterAction(entity.id(), interaction.id(), interaction.type(), branch.id(),
                check.roll(), check.total(), branch.difficulty(), check.success(), check.critical());
        logger.fine(() -> String.format("Turn %d: %s tried %s/%s, rolled %d (total %d) against %d: %s",
                workspace.turn(), entity.id(), interaction.id(), branch.id(), check.roll(), check.total(),
                branch.difficulty(), check.success() ? "success" : "failure"));
        return Optional.of(action);
    }

    static Entity applyEffects(Entity entity, List<Effect> effects, Map<String, Double> resources) {
        Entity updated = entity;
        for (Effect effect : effects) {
            updated = effect.applyTo(updated);
            effect.applyTo(resources);
        }
        return updated;
    }
}
