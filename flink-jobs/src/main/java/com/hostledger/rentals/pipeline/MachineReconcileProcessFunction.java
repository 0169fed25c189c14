package com.hostledger.rentals.pipeline;

import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hostledger.rentals.model.LifecycleEventType;
import com.hostledger.rentals.model.MachineState;
import com.hostledger.rentals.model.RejectedSnapshotEnvelope;
import com.hostledger.rentals.model.RentalLifecycleEvent;
import com.hostledger.rentals.model.RentalSession;
import com.hostledger.rentals.quality.RejectedSnapshotEnvelopeFactory;
import com.hostledger.rentals.reconcile.ReconcileResult;
import com.hostledger.rentals.reconcile.ReconcileSettings;
import com.hostledger.rentals.reconcile.RentalReconciler;
import com.hostledger.rentals.registry.RegistryCodec;
import com.hostledger.rentals.registry.RentalRegistry;
import com.hostledger.rentals.util.BuildMetadata;

/**
 * Per-machine reconciliation operator keyed by machine id.
 *
 * <p>The machine's {@link RentalRegistry} lives in keyed state as JSON. The first snapshot of a
 * machine seeds the registry from the observed occupancy; every later snapshot runs one
 * reconciliation pass against the stored registry. The new registry is written once per pass and
 * only after the pass succeeded, so a failing pass leaves the prior registry in place and routes
 * the snapshot to the DLQ. Sessions finalized in the pass are emitted on the archive side output.</p>
 */
public class MachineReconcileProcessFunction extends KeyedProcessFunction<Long, MachineState, RentalLifecycleEvent> {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MachineReconcileProcessFunction.class);

    static final String REGISTRY_STATE_NAME = "rental-registry";

    private final ReconcileSettings settings;
    private final OutputTag<RentalSession> archiveTag;
    private final OutputTag<RejectedSnapshotEnvelope> dlqTag;

    private transient ValueState<String> registryState;
    private transient Counter snapshotCounter;
    private transient Counter rejectedCounter;
    private transient Counter startedCounter;
    private transient Counter endedCounter;
    private transient Counter pausedCounter;
    private transient Counter resumedCounter;
    private transient Counter ambiguousEndCounter;

    public MachineReconcileProcessFunction(
            ReconcileSettings settings,
            OutputTag<RentalSession> archiveTag,
            OutputTag<RejectedSnapshotEnvelope> dlqTag) {
        this.settings = settings;
        this.archiveTag = archiveTag;
        this.dlqTag = dlqTag;
    }

    @Override
    public void open(org.apache.flink.configuration.Configuration parameters) {
        registryState = getRuntimeContext().getState(new ValueStateDescriptor<>(REGISTRY_STATE_NAME, String.class));

        MetricGroup metrics = getRuntimeContext().getMetricGroup().addGroup("rental_monitor");
        snapshotCounter = metrics.counter("snapshots");
        rejectedCounter = metrics.counter("rejected");
        startedCounter = metrics.counter("sessions_started");
        endedCounter = metrics.counter("sessions_ended");
        pausedCounter = metrics.counter("sessions_paused");
        resumedCounter = metrics.counter("sessions_resumed");
        ambiguousEndCounter = metrics.counter("ambiguous_ends");
        LOG.info("Machine reconciler initialized (diskToleranceGb={}, alertPingIntervalMs={}, build={})",
                settings.diskToleranceGb, settings.alertPingIntervalMs, BuildMetadata.current().identity());
    }

    @Override
    public void processElement(MachineState state, Context ctx, Collector<RentalLifecycleEvent> out) throws Exception {
        if (state == null) {
            return;
        }
        snapshotCounter.inc();

        ReconcileResult result;
        try {
            RentalRegistry prior = RegistryCodec.decode(registryState.value());
            if (prior != null && state.observedAt <= prior.lastObservedAt) {
                LOG.debug("Ignoring stale snapshot for machine {} (observedAt={}, lastObservedAt={})",
                        state.machineId, state.observedAt, prior.lastObservedAt);
                return;
            }
            if (prior == null) {
                LOG.info("No registry for machine {}; seeding from occupancy '{}'", state.machineId, state.gpuOccupancy);
                result = RentalReconciler.seed(state, settings);
            } else {
                result = RentalReconciler.reconcile(prior, state, settings);
            }
        } catch (Exception ex) {
            rejectedCounter.inc();
            LOG.error("Reconciliation failed for machine {} at {}; keeping prior registry",
                    state.machineId, state.observedAt, ex);
            ctx.output(dlqTag, RejectedSnapshotEnvelopeFactory.forReconcileFailure(state, ex));
            return;
        }

        registryState.update(RegistryCodec.encode(result.registry));

        for (RentalLifecycleEvent event : result.events) {
            out.collect(event);
        }
        for (RentalSession archived : result.archived) {
            ctx.output(archiveTag, archived);
        }
        recordMetrics(result);
    }

    private void recordMetrics(ReconcileResult result) {
        startedCounter.inc(result.count(LifecycleEventType.START));
        endedCounter.inc(result.count(LifecycleEventType.END));
        pausedCounter.inc(result.count(LifecycleEventType.PAUSE));
        resumedCounter.inc(result.count(LifecycleEventType.RESUME));
        ambiguousEndCounter.inc(result.ambiguousEnds);
    }
}
