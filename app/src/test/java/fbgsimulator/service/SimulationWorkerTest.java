package fbgsimulator.service;

import fbgsimulator.config.SimulationRequest;
import fbgsimulator.domain.simulation.SimulationOutcome;
import fbgsimulator.exception.ErrorKind;
import fbgsimulator.physics.simulator.ProgressListener;
import fbgsimulator.physics.simulator.SimulationPipeline;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Slf4j
@ExtendWith(MockitoExtension.class)
class SimulationWorkerTest {

    @Mock
    private SimulationPipeline pipeline;

    private SimulationWorker worker;
    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);
    private final SimulationRequest request = SimulationRequest.withDefaults(null);
    private final SimulationOutcome failed = SimulationOutcome.failure(ErrorKind.INTERNAL, "simulado");

    @BeforeEach
    void setUp() {
        worker = new SimulationWorker(pipeline);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        release.countDown();
        worker.awaitIdle(5, TimeUnit.SECONDS);
        worker.close();
    }

    private void stubBlockingPipeline() {
        when(pipeline.run(any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return failed;
        });
    }

    @Test
    @DisplayName("Una segunda petición durante una ejecución se rechaza sin encolarla")
    void submit_whileBusy_isRejected() throws Exception {
        // Arrange
        stubBlockingPipeline();
        Optional<CompletableFuture<SimulationOutcome>> first = worker.submit(request, ProgressListener.NONE);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // Act
        Optional<CompletableFuture<SimulationOutcome>> second = worker.submit(request, ProgressListener.NONE);

        // Assert
        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThat(worker.isBusy()).isTrue();

        release.countDown();
        assertThat(first.get().get(5, TimeUnit.SECONDS)).isSameAs(failed);
        verify(pipeline, times(1)).run(any(), any());
    }

    @Test
    @DisplayName("Cerrar el worker con una ejecución activa es un error")
    void close_whileBusy_throws() throws InterruptedException {
        stubBlockingPipeline();
        worker.submit(request, ProgressListener.NONE);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> worker.close())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Simulation thread is still in progress.");
    }

    @Test
    @DisplayName("Al terminar una ejecución el worker admite la siguiente")
    void submit_afterCompletion_isAccepted() throws Exception {
        when(pipeline.run(any(), any())).thenReturn(failed);

        SimulationOutcome firstOutcome = worker.submit(request, ProgressListener.NONE).orElseThrow()
                .get(5, TimeUnit.SECONDS);
        assertThat(worker.awaitIdle(5, TimeUnit.SECONDS)).isTrue();
        SimulationOutcome secondOutcome = worker.submit(request, ProgressListener.NONE).orElseThrow()
                .get(5, TimeUnit.SECONDS);

        assertThat(firstOutcome).isSameAs(failed);
        assertThat(secondOutcome).isSameAs(failed);
        assertThat(worker.isBusy()).isFalse();
        verify(pipeline, times(2)).run(any(), any());
    }

    @Test
    @DisplayName("awaitIdle sin ninguna ejecución previa vuelve enseguida")
    void awaitIdle_withoutRuns_returnsImmediately() throws InterruptedException {
        assertThat(worker.awaitIdle(0, TimeUnit.MILLISECONDS)).isTrue();
        assertThat(worker.isBusy()).isFalse();
    }

    @Test
    @DisplayName("awaitIdle espera al final de la ejecución aunque esta termine con error")
    void awaitIdle_afterFailingRun_returnsTrue() throws Exception {
        when(pipeline.run(any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            throw new IllegalStateException("fallo simulado");
        });
        CompletableFuture<SimulationOutcome> future = worker.submit(request, ProgressListener.NONE).orElseThrow();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        release.countDown();

        assertThat(worker.awaitIdle(5, TimeUnit.SECONDS)).isTrue();
        assertThat(future).isCompletedExceptionally();
        assertThat(worker.isBusy()).isFalse();
    }

    @Test
    @DisplayName("awaitIdle devuelve false si la ejecución no termina a tiempo")
    void awaitIdle_timesOut() throws InterruptedException {
        stubBlockingPipeline();
        worker.submit(request, ProgressListener.NONE);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(worker.awaitIdle(50, TimeUnit.MILLISECONDS)).isFalse();
    }
}
