package kr.crownrpg.chat.core.config;

import kr.crownrpg.chat.core.session.ChatSessionSettings;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsed {@code chat.yml}.
 */
public final class ChatConfig {

    public static final String FILE_NAME = "chat.yml";

    private final String botName;
    private final int botId;
    private final ChatSessionSettings sessionSettings;
    private final List<ChannelYamlConfig> channels;

    private ChatConfig(String botName, int botId, ChatSessionSettings sessionSettings, List<ChannelYamlConfig> channels) {
        this.botName = botName;
        this.botId = botId;
        this.sessionSettings = sessionSettings;
        this.channels = List.copyOf(channels);
    }

    /**
     * Loads {@code chat.yml} from the data directory, copying the bundled default there first if absent.
     */
    public static ChatConfig load(Path dataDir, ClassLoader loader) {
        try {
            if (!Files.exists(dataDir)) Files.createDirectories(dataDir);

            Path file = dataDir.resolve(FILE_NAME);
            if (!Files.exists(file)) {
                try (InputStream in = loader.getResourceAsStream(FILE_NAME)) {
                    if (in == null) throw new IllegalStateException("리소스에 기본 chat.yml이 존재하지 않습니다.");
                    try (OutputStream out = Files.newOutputStream(file)) {
                        in.transferTo(out);
                    }
                }
            }

            try (InputStream in = Files.newInputStream(file)) {
                return fromMap(read(in));
            }
        } catch (Exception e) {
            throw new IllegalStateException("chat.yml을 불러오지 못했습니다.", e);
        }
    }

    /**
     * Loads the {@code chat.yml} bundled on the classpath.
     */
    public static ChatConfig loadDefaults(ClassLoader loader) {
        try (InputStream in = loader.getResourceAsStream(FILE_NAME)) {
            if (in == null) throw new IllegalStateException("리소스에 기본 chat.yml이 존재하지 않습니다.");
            return fromMap(read(in));
        } catch (IOException e) {
            throw new IllegalStateException("chat.yml을 불러오지 못했습니다.", e);
        }
    }

    public static ChatConfig fromMap(Map<String, Object> root) {
        Map<String, Object> safeRoot = root == null ? new HashMap<>() : root;
        Map<String, Object> server = ConfigValues.section(safeRoot.get("server"));
        Map<String, Object> session = ConfigValues.section(safeRoot.get("session"));

        String botName = ConfigValues.trimToEmpty(server.get("bot-name"));
        if (botName.isBlank()) {
            botName = "CrownBot";
        }
        int botId = ConfigValues.toInt(server.get("bot-id"), 1);

        ChatSessionSettings defaults = ChatSessionSettings.defaults();
        ChatSessionSettings sessionSettings = new ChatSessionSettings(
                ConfigValues.toInt(session.get("outbound-queue-capacity"), defaults.outboundQueueCapacity()),
                ConfigValues.toInt(session.get("drop-warn-threshold"), defaults.dropWarnThreshold()));

        List<ChannelYamlConfig> channels = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Object entry : ConfigValues.list(safeRoot.get("channels"))) {
            if (!(entry instanceof Map<?, ?> m)) {
                throw new IllegalArgumentException("Invalid channel entry: " + entry);
            }
            ChannelYamlConfig channel = ChannelYamlConfig.fromMap(ConfigValues.castMap(m));
            if (!seen.add(channel.name())) {
                throw new IllegalArgumentException("duplicate channel name: " + channel.name());
            }
            channels.add(channel);
        }
        return new ChatConfig(botName, botId, sessionSettings, channels);
    }

    private static Map<String, Object> read(InputStream in) {
        Object obj = new Yaml().load(in);
        return ConfigValues.section(obj);
    }

    public String botName() { return botName; }
    public int botId() { return botId; }
    public ChatSessionSettings sessionSettings() { return sessionSettings; }
    public List<ChannelYamlConfig> channels() { return channels; }
}
