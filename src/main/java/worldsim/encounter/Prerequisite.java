package worldsim.encounter;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import worldsim.world.Entity;

import java.util.Objects;

/**
 * Requirement a character has to meet before an encounter can start around them.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Prerequisite.AttributeAtLeast.class, name = "attribute"),
        @JsonSubTypes.Type(value = Prerequisite.SkillAtLeast.class, name = "skill"),
        @JsonSubTypes.Type(value = Prerequisite.LevelAtLeast.class, name = "level"),
        @JsonSubTypes.Type(value = Prerequisite.QuestStatus.class, name = "quest"),
        @JsonSubTypes.Type(value = Prerequisite.HasItem.class, name = "item")
})
public sealed interface Prerequisite permits Prerequisite.AttributeAtLeast, Prerequisite.SkillAtLeast,
        Prerequisite.LevelAtLeast, Prerequisite.QuestStatus, Prerequisite.HasItem {

    boolean isMetBy(Entity character);

    record AttributeAtLeast(String attribute, double value) implements Prerequisite {
        @Override
        public boolean isMetBy(Entity character) {
            return character.attributes().score(attribute) >= value;
        }
    }

    record SkillAtLeast(String skill, double value) implements Prerequisite {
        @Override
        public boolean isMetBy(Entity character) {
            return character.skill(skill) >= value;
        }
    }

    record LevelAtLeast(int value) implements Prerequisite {
        @Override
        public boolean isMetBy(Entity character) {
            return character.level() >= value;
        }
    }

    record QuestStatus(String questId, String status) implements Prerequisite {
        @Override
        public boolean isMetBy(Entity character) {
            return Objects.equals(character.quests().get(questId), status);
        }
    }

    record HasItem(String itemId) implements Prerequisite {
        @Override
        public boolean isMetBy(Entity character) {
            return character.inventory().contains(itemId);
        }
    }
}
