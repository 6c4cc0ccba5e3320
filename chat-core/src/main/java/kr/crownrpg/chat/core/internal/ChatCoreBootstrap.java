package kr.crownrpg.chat.core.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.Channel;
import kr.crownrpg.chat.api.access.AccessLevel;
import kr.crownrpg.chat.api.channel.ChannelException;
import kr.crownrpg.chat.api.channel.ChatChannel;
import kr.crownrpg.chat.api.lifecycle.ManagedLifecycle;
import kr.crownrpg.chat.core.codec.JsonChatPacketEncoder;
import kr.crownrpg.chat.core.config.ChannelYamlConfig;
import kr.crownrpg.chat.core.config.ChatConfig;
import kr.crownrpg.chat.core.directory.InMemoryChannelDirectory;
import kr.crownrpg.chat.core.directory.SessionChannelIndex;
import kr.crownrpg.chat.core.service.ChatService;
import kr.crownrpg.chat.core.session.NettyChatSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 서버 쪽에서 호출하는 "채팅 코어 조립" 클래스.
 * - 설정 → 디렉터리(상시 채널 등록) → 인코더 → ChatService 순서로 조립
 * - 네트워크 계층은 {@link #openSession}으로 세션만 만들어 넘기면 됨
 */
public final class ChatCoreBootstrap implements ManagedLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatCoreBootstrap.class);

    private final ChatConfig config;

    private InMemoryChannelDirectory directory;
    private ChatService service;

    public ChatCoreBootstrap(ChatConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public synchronized void start() {
        if (service != null) {
            return;
        }
        InMemoryChannelDirectory newDirectory = new InMemoryChannelDirectory();
        for (ChannelYamlConfig channel : config.channels()) {
            newDirectory.create(channel.toDefinition());
        }
        JsonChatPacketEncoder encoder = new JsonChatPacketEncoder(new ObjectMapper());
        this.directory = newDirectory;
        this.service = new ChatService(newDirectory, encoder, new SessionChannelIndex(), config.botName(), config.botId());
        LOGGER.info("채팅 코어를 시작했습니다 (상시 채널 {}개)", config.channels().size());
    }

    public synchronized ChatService service() {
        if (service == null) throw new IllegalStateException("ChatCoreBootstrap not started");
        return service;
    }

    /**
     * Wraps an accepted client connection as a chat session using the configured queue policy.
     */
    public NettyChatSession openSession(int id, String name, AccessLevel accessLevel, Channel channel) {
        return new NettyChatSession(id, name, accessLevel, channel, config.sessionSettings());
    }

    @Override
    public synchronized void stop() {
        if (service == null) {
            return;
        }
        for (ChatChannel channel : directory.channels()) {
            try {
                service.deleteChannel(channel.internalName());
            } catch (ChannelException e) {
                LOGGER.debug("종료 중 채널 {} 삭제를 건너뜁니다 ({})", channel.internalName(), e.reason());
            }
        }
        LOGGER.info("채팅 코어를 종료했습니다");
        service = null;
        directory = null;
    }
}
