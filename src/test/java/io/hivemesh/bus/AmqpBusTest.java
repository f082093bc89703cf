package io.hivemesh.bus;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Consumer;
import io.hivemesh.broker.BrokerSettings;
import io.hivemesh.broker.ConnectionManager;
import io.hivemesh.delivery.DeadLetterStore;
import io.hivemesh.delivery.DeliveryController;
import io.hivemesh.model.Ballot;
import io.hivemesh.model.Envelope;
import io.hivemesh.model.MessageType;
import io.hivemesh.model.Priority;
import io.hivemesh.model.ResultPayload;
import io.hivemesh.model.StatusPayload;
import io.hivemesh.model.TaskPayload;
import io.hivemesh.routing.EnvelopeCodec;
import io.hivemesh.routing.MessageRouter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class AmqpBusTest {
    private Channel channel;
    private AmqpBus bus;

    @BeforeEach
    void setUp() throws Exception {
        Connection connection = Mockito.mock(Connection.class);
        channel = Mockito.mock(Channel.class);
        Mockito.when(connection.createChannel()).thenReturn(channel);
        Mockito.when(connection.isOpen()).thenReturn(true);
        Mockito.when(channel.isOpen()).thenReturn(true);
        ConnectionManager connections = new ConnectionManager(
                new BrokerSettings("amqp://localhost:5672", "bus-test", 30, 1, false, 0),
                () -> connection,
                (task, delayMs) -> { }
        );
        connections.connect();
        bus = new AmqpBus(connections);
    }

    @Test
    void tasksArePersistentOnTaskQueue() throws Exception {
        Envelope task = new Envelope("t-1", MessageType.TASK, "leader-1", 1_000L,
                new TaskPayload("Build", null, Priority.HIGH, "leader-1", 1_000L, false, null, null, Map.of()));

        Assertions.assertEquals("t-1", bus.publishTask(task));

        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        Mockito.verify(channel).basicPublish(ArgumentMatchers.eq(""), ArgumentMatchers.eq("agent.tasks"),
                props.capture(), ArgumentMatchers.any(byte[].class));
        Assertions.assertEquals(2, props.getValue().getDeliveryMode());
        Assertions.assertEquals("t-1", props.getValue().getMessageId());
        Assertions.assertEquals("leader-1", props.getValue().getAppId());
        Assertions.assertEquals("task", props.getValue().getType());
        Assertions.assertEquals("application/json", props.getValue().getContentType());
    }

    @Test
    void repliesGoStraightToTheAskersInbox() throws Exception {
        Envelope vote = new Envelope("v-1", MessageType.RESULT, "w-1", 1_000L,
                ResultPayload.vote("s-1", Ballot.choice("A", 0.8, 2), "w-1", 1_000L));

        bus.sendReply("replies.leader-1", vote);

        Mockito.verify(channel).basicPublish(ArgumentMatchers.eq(""), ArgumentMatchers.eq("replies.leader-1"),
                ArgumentMatchers.any(AMQP.BasicProperties.class), ArgumentMatchers.any(byte[].class));
        Assertions.assertThrows(IllegalArgumentException.class, () -> bus.sendReply(" ", vote));
    }

    @Test
    void statusUsesEventRoutingKey() throws Exception {
        Envelope status = new Envelope("s-1", MessageType.STATUS, "w-1", 1_000L,
                new StatusPayload("w-1", "worker", "task_started", Map.of()));

        bus.publishStatus(status);

        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        Mockito.verify(channel).basicPublish(ArgumentMatchers.eq("agent.status"),
                ArgumentMatchers.eq("agent.status.task.started"), props.capture(), ArgumentMatchers.any(byte[].class));
        Assertions.assertEquals(1, props.getValue().getDeliveryMode());
    }

    @Test
    void resultsGoToResultsQueue() throws Exception {
        Envelope result = new Envelope("r-1", MessageType.RESULT, "w-1", 1_000L,
                ResultPayload.taskResult("t-1", "completed", "{}", "w-1", 1_000L, 5L));

        bus.publishResult(result);

        Mockito.verify(channel).basicPublish(ArgumentMatchers.eq(""), ArgumentMatchers.eq("agent.results"),
                ArgumentMatchers.any(AMQP.BasicProperties.class), ArgumentMatchers.any(byte[].class));
    }

    @Test
    void wrongEnvelopeTypeIsRefused() {
        Envelope status = new Envelope("s-2", MessageType.STATUS, "w-1", 1_000L,
                new StatusPayload("w-1", "worker", "connected", Map.of()));

        Assertions.assertThrows(IllegalArgumentException.class, () -> bus.publishTask(status));
    }

    @Test
    void consumedDeliveriesSettleThroughController() throws Exception {
        List<String> handled = new ArrayList<>();
        MessageRouter router = new MessageRouter().register(MessageType.STATUS, env -> handled.add(env.id()));
        DeliveryController controller = new DeliveryController(router, new DeadLetterStore(), 3, Clock.systemUTC());
        Mockito.when(channel.basicConsume(ArgumentMatchers.eq("status.w-1"), ArgumentMatchers.eq(false),
                ArgumentMatchers.any(Consumer.class))).thenReturn("ctag-1");

        Assertions.assertEquals("ctag-1", bus.consume("status.w-1", controller));

        ArgumentCaptor<Consumer> consumer = ArgumentCaptor.forClass(Consumer.class);
        Mockito.verify(channel).basicConsume(ArgumentMatchers.eq("status.w-1"), ArgumentMatchers.eq(false),
                consumer.capture());
        Envelope status = new Envelope("s-3", MessageType.STATUS, "w-2", 1_000L,
                new StatusPayload("w-2", "worker", "connected", Map.of()));
        AMQP.BasicProperties props = new AMQP.BasicProperties.Builder().messageId("s-3").build();

        consumer.getValue().handleDelivery("ctag-1",
                new com.rabbitmq.client.Envelope(7L, false, "agent.status", "agent.status.connected"),
                props, new EnvelopeCodec().encode(status));
        consumer.getValue().handleDelivery("ctag-1",
                new com.rabbitmq.client.Envelope(8L, false, "agent.status", "agent.status.connected"),
                props, "garbage".getBytes());

        Assertions.assertEquals(List.of("s-3"), handled);
        Mockito.verify(channel).basicAck(7L, false);
        Mockito.verify(channel).basicReject(8L, false);
    }
}
