package kr.crownrpg.chat.core.directory;

import kr.crownrpg.chat.api.Preconditions;
import kr.crownrpg.chat.api.channel.ChannelDefinition;
import kr.crownrpg.chat.api.channel.ChannelException;
import kr.crownrpg.chat.api.channel.ChatChannel;
import kr.crownrpg.chat.api.channel.InstanceKind;
import kr.crownrpg.chat.api.directory.ChannelDirectory;
import kr.crownrpg.chat.api.session.ChatSession;
import kr.crownrpg.chat.core.channel.DefaultChatChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Thread-safe registry mapping internal channel names to live channels.
 * <p>
 * Never takes a channel lock itself, so instance channels may call {@link #removeChannel} while
 * holding their own lock.
 */
public final class InMemoryChannelDirectory implements ChannelDirectory {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryChannelDirectory.class);

    private final Map<String, ChatChannel> channels = new ConcurrentHashMap<>();

    @Override
    public Optional<ChatChannel> find(String internalName) {
        if (internalName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(channels.get(internalName));
    }

    @Override
    public ChatChannel create(ChannelDefinition definition) {
        Preconditions.checkNotNull(definition, "definition");
        ChatChannel channel = new DefaultChatChannel(definition, this);
        ChatChannel previous = channels.putIfAbsent(definition.name(), channel);
        if (previous != null) {
            throw new ChannelException(ChannelException.Reason.CHANNEL_EXISTS, definition.name(),
                    "channel " + definition.name() + " already exists");
        }
        LOGGER.info("채널 {}을(를) 생성했습니다 (instance={})", definition.name(), definition.instance());
        return channel;
    }

    @Override
    public ChatChannel createInstance(InstanceKind kind, long id, String topic) {
        ChannelDefinition definition = ChannelDefinition.instance(kind, id, topic);
        // 삭제 중(destroy 후 map 제거 전)인 채널은 새 채널로 교체
        return channels.compute(definition.name(), (name, existing) -> {
            if (existing != null && !existing.isDestroyed()) {
                return existing;
            }
            LOGGER.info("인스턴스 채널 {}을(를) 생성했습니다", name);
            return new DefaultChatChannel(definition, this);
        });
    }

    @Override
    public boolean removeChannel(ChatChannel channel) {
        Preconditions.checkNotNull(channel, "channel");
        boolean removed = channels.remove(channel.internalName(), channel);
        if (!removed) {
            LOGGER.warn("디렉터리에 없는 채널 {}의 제거 요청입니다", channel.internalName());
        }
        return removed;
    }

    @Override
    public List<ChatSession> delete(String internalName) {
        ChatChannel channel = channels.get(internalName);
        if (channel == null) {
            return List.of();
        }
        // destroy first so a racing final leave observes DESTROYED instead of a missing entry
        List<ChatSession> former = channel.destroy();
        channels.remove(internalName, channel);
        LOGGER.info("관리자 요청으로 채널 {}을(를) 삭제했습니다", internalName);
        return former;
    }

    @Override
    public Collection<ChatChannel> channels() {
        return List.copyOf(channels.values());
    }

    @Override
    public List<ChatChannel> autoJoinChannels() {
        return channels.values().stream()
                .filter(ChatChannel::autoJoin)
                .filter(channel -> !channel.isInstance())
                .sorted(Comparator.comparing(ChatChannel::internalName))
                .collect(Collectors.toList());
    }

    public int size() {
        return channels.size();
    }
}
