package io.hivemesh.broker;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.io.IOException;
import java.util.List;
import java.util.Map;

final class TopologyBuilderTest {

    @Test
    void declaresExchangesThenQueuesThenBindings() throws Exception {
        Channel channel = Mockito.mock(Channel.class);

        new TopologyBuilder().declare(channel, Topology.forAgent("agent-1", List.of("agent.status.task.#")));

        InOrder order = Mockito.inOrder(channel);
        order.verify(channel).exchangeDeclare("agent.dlx", BuiltinExchangeType.FANOUT, true);
        order.verify(channel).exchangeDeclare("agent.brainstorm", BuiltinExchangeType.FANOUT, true);
        order.verify(channel).exchangeDeclare("agent.status", BuiltinExchangeType.TOPIC, true);
        order.verify(channel).queueDeclare("agent.dead-letter", true, false, false, null);
        order.verify(channel).queueDeclare(ArgumentMatchers.eq("agent.tasks"), ArgumentMatchers.eq(true),
                ArgumentMatchers.eq(false), ArgumentMatchers.eq(false),
                ArgumentMatchers.<Map<String, Object>>argThat(args -> args != null
                        && Long.valueOf(3_600_000L).equals(args.get("x-message-ttl"))
                        && Integer.valueOf(10_000).equals(args.get("x-max-length"))
                        && "agent.dlx".equals(args.get("x-dead-letter-exchange"))));
        order.verify(channel).queueDeclare("agent.results", true, false, false, null);
        order.verify(channel).queueDeclare("replies.agent-1", false, true, true, null);
        order.verify(channel).queueDeclare("brainstorm.agent-1", false, true, true, null);
        order.verify(channel).queueDeclare("status.agent-1", false, true, true, null);
        order.verify(channel).queueBind("agent.dead-letter", "agent.dlx", "");
        order.verify(channel).queueBind("brainstorm.agent-1", "agent.brainstorm", "");
        order.verify(channel).queueBind("status.agent-1", "agent.status", "agent.status.task.#");
    }

    @Test
    void sharedTopologyHasNoPrivateInboxes() throws Exception {
        Channel channel = Mockito.mock(Channel.class);

        new TopologyBuilder().declare(channel, Topology.shared());

        Mockito.verify(channel, Mockito.never()).queueDeclare(ArgumentMatchers.startsWith("brainstorm."),
                ArgumentMatchers.anyBoolean(), ArgumentMatchers.anyBoolean(), ArgumentMatchers.anyBoolean(),
                ArgumentMatchers.any());
        Mockito.verify(channel, Mockito.times(1)).queueBind(ArgumentMatchers.anyString(),
                ArgumentMatchers.anyString(), ArgumentMatchers.anyString());
    }

    @Test
    void workerWithoutStatusInboxSkipsStatusQueue() {
        Topology topology = Topology.forAgent("w-1", true, false, List.of());

        Assertions.assertTrue(topology.queues().stream().anyMatch(q -> q.name().equals("brainstorm.w-1")));
        Assertions.assertTrue(topology.queues().stream().noneMatch(q -> q.name().equals("status.w-1")));
        Assertions.assertTrue(topology.queues().stream().anyMatch(q -> q.name().equals("replies.w-1")));
    }

    @Test
    void replyOnlyTopologyAddsJustTheReplyInbox() {
        Topology topology = Topology.forAgent("cli-1", false, false, List.of());

        Assertions.assertEquals(Topology.shared().queues().size() + 1, topology.queues().size());
        Topology.QueueSpec inbox = topology.queues().get(topology.queues().size() - 1);
        Assertions.assertEquals("replies.cli-1", inbox.name());
        Assertions.assertTrue(inbox.exclusive());
        Assertions.assertEquals(Topology.shared().bindings(), topology.bindings());
    }

    @Test
    void declarationFailureNamesTheResource() throws Exception {
        Channel channel = Mockito.mock(Channel.class);
        Mockito.when(channel.queueDeclare(ArgumentMatchers.eq("agent.results"), ArgumentMatchers.anyBoolean(),
                        ArgumentMatchers.anyBoolean(), ArgumentMatchers.anyBoolean(), ArgumentMatchers.any()))
                .thenThrow(new IOException("PRECONDITION_FAILED"));

        BrokerConnectionException error = Assertions.assertThrows(BrokerConnectionException.class,
                () -> new TopologyBuilder().declare(channel, Topology.shared()));

        Assertions.assertEquals("Failed to declare queue agent.results", error.getMessage());
    }
}
