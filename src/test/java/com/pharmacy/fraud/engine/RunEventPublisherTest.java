package com.pharmacy.fraud.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RunEventPublisherTest {

    @Mock
    private RunEventSink first;

    @Mock
    private RunEventSink second;

    @Test
    void failingSink_doesNotStopDeliveryToOthers() {
        doThrow(new IllegalStateException("down")).when(first).onAggregationCompleted("run-1", 3, 0);
        RunEventPublisher publisher = new RunEventPublisher(List.of(first, second));

        assertThatCode(() -> publisher.aggregationCompleted("run-1", 3, 0)).doesNotThrowAnyException();

        verify(second).onAggregationCompleted("run-1", 3, 0);
    }

    @Test
    void dispatchStarted_reachesEverySink() {
        RunEventPublisher publisher = new RunEventPublisher(List.of(first, second));

        publisher.dispatchStarted("run-1", List.of("a", "b"));

        verify(first).onDispatchStarted("run-1", List.of("a", "b"));
        verify(second).onDispatchStarted("run-1", List.of("a", "b"));
    }

    @Test
    void none_publishesNothing() {
        assertThatCode(() -> RunEventPublisher.none().dispatchStarted("run-1", List.of("a")))
                .doesNotThrowAnyException();
        verifyNoInteractions(first, second);
    }
}
