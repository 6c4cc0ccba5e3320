package kr.crownrpg.chat.core.config;

import kr.crownrpg.chat.api.access.AccessLevel;
import kr.crownrpg.chat.api.channel.ChannelDefinition;
import kr.crownrpg.chat.api.channel.ChannelNames;

import java.util.Map;

/**
 * One entry of the {@code channels} list in {@code chat.yml}.
 */
public record ChannelYamlConfig(String name, String topic, AccessLevel read, AccessLevel write, boolean autoJoin) {

    public static ChannelYamlConfig fromMap(Map<String, Object> section) {
        if (section == null) {
            throw new IllegalArgumentException("channel entry is missing");
        }
        String name = ConfigValues.trimToEmpty(section.get("name"));
        if (name.isBlank()) {
            throw new IllegalArgumentException("channels[].name must not be blank");
        }
        if (ChannelNames.isInstanceName(name)) {
            throw new IllegalArgumentException("channels[].name must not use an instance prefix: " + name);
        }
        String topic = ConfigValues.str(section.get("topic"), "");
        AccessLevel read = AccessLevel.fromConfigName(ConfigValues.trimToEmpty(section.get("read")), AccessLevel.NORMAL);
        AccessLevel write = AccessLevel.fromConfigName(ConfigValues.trimToEmpty(section.get("write")), AccessLevel.NORMAL);
        boolean autoJoin = ConfigValues.toBoolean(section.get("auto-join"), true);
        return new ChannelYamlConfig(name, topic, read, write, autoJoin);
    }

    public ChannelDefinition toDefinition() {
        return new ChannelDefinition(name, topic, read, write, autoJoin, false);
    }
}
