package com.example.sos.trigger;

import com.example.sos.capabilities.Subscription;
import com.example.sos.scheduling.ScheduledTask;
import com.example.sos.scheduling.TaskScheduler;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Turns taps, long presses, shakes and speech into at most one activation per sequence.
 *
 * <p>Tap, shake and voice go through CONFIRMING; a long press arms a countdown that activates
 * on its own once the hold completes. While a sequence is in progress every new trigger
 * request is rejected. All transitions are serialized on this instance.
 */
@ApplicationScoped
public class TriggerStateMachine {

    private static final Logger LOG = Logger.getLogger(TriggerStateMachine.class);
    private static final Duration TICK = Duration.ofSeconds(1);

    private final ActivationHandler handler;
    private final TaskScheduler scheduler;
    private final int holdSeconds;
    private final boolean shakeEnabled;
    private final double shakeThresholdG;
    private final boolean voiceEnabled;
    private final boolean voiceRequiresConfirmation;
    private final VoicePhrases phrases;

    private final List<TriggerListener> listeners = new CopyOnWriteArrayList<>();

    private TriggerState state = TriggerState.IDLE;
    private TriggerSource source;
    private int elapsedSeconds;
    private double progress;
    // bumped whenever a countdown stops so late ticks are ignored
    private long generation;
    private ScheduledTask pendingTick;

    public TriggerStateMachine(
        ActivationHandler handler,
        TaskScheduler scheduler,
        @ConfigProperty(name = "sos.trigger.hold-seconds", defaultValue = "3") int holdSeconds,
        @ConfigProperty(
            name = "sos.trigger.shake.enabled",
            defaultValue = "true"
        ) boolean shakeEnabled,
        @ConfigProperty(
            name = "sos.trigger.shake.threshold-g",
            defaultValue = "2.5"
        ) double shakeThresholdG,
        @ConfigProperty(
            name = "sos.trigger.voice.enabled",
            defaultValue = "true"
        ) boolean voiceEnabled,
        @ConfigProperty(
            name = "sos.trigger.voice.require-confirmation",
            defaultValue = "true"
        ) boolean voiceRequiresConfirmation,
        @ConfigProperty(
            name = "sos.trigger.voice.trigger-phrases",
            defaultValue = "help,emergency,sos,danger,call for help"
        ) List<String> triggerPhrases,
        @ConfigProperty(
            name = "sos.trigger.voice.cancel-phrases",
            defaultValue = "cancel,stop,nevermind,false alarm"
        ) List<String> cancelPhrases,
        @ConfigProperty(
            name = "sos.trigger.voice.confirm-phrases",
            defaultValue = "confirm,yes,send it"
        ) List<String> confirmPhrases
    ) {
        if (holdSeconds < 1) {
            throw new IllegalArgumentException("sos.trigger.hold-seconds must be at least 1");
        }
        this.handler = handler;
        this.scheduler = scheduler;
        this.holdSeconds = holdSeconds;
        this.shakeEnabled = shakeEnabled;
        this.shakeThresholdG = shakeThresholdG;
        this.voiceEnabled = voiceEnabled;
        this.voiceRequiresConfirmation = voiceRequiresConfirmation;
        this.phrases = new VoicePhrases(triggerPhrases, cancelPhrases, confirmPhrases);
    }

    public synchronized boolean tap() {
        if (!acceptsNewSequence(TriggerSource.TAP)) return false;
        transition(TriggerState.CONFIRMING, TriggerSource.TAP);
        return true;
    }

    public synchronized boolean confirm() {
        if (state != TriggerState.CONFIRMING) {
            LOG.debugf("Confirm ignored in state %s", state);
            return false;
        }
        activate();
        return true;
    }

    public synchronized boolean cancel() {
        if (state != TriggerState.CONFIRMING && state != TriggerState.ARMING) {
            return false;
        }
        boolean wasArming = state == TriggerState.ARMING;
        stopCountdown();
        if (wasArming) {
            publishProgress(0.0);
        }
        transition(TriggerState.IDLE, null);
        return true;
    }

    public synchronized boolean press() {
        if (!acceptsNewSequence(TriggerSource.LONG_PRESS)) return false;
        elapsedSeconds = 0;
        progress = 0.0;
        transition(TriggerState.ARMING, TriggerSource.LONG_PRESS);
        scheduleTick();
        return true;
    }

    public synchronized boolean release() {
        if (state != TriggerState.ARMING) {
            return false;
        }
        LOG.infof("Long press released after %d s", elapsedSeconds);
        stopCountdown();
        publishProgress(0.0);
        transition(TriggerState.IDLE, null);
        return true;
    }

    // one accelerometer sample, in g
    public synchronized boolean onAcceleration(double x, double y, double z) {
        if (!shakeEnabled) return false;
        double magnitude = Math.sqrt(x * x + y * y + z * z);
        if (magnitude <= shakeThresholdG) return false;
        if (!acceptsNewSequence(TriggerSource.SHAKE)) return false;
        LOG.infof("Shake detected (%.2f g)", magnitude);
        transition(TriggerState.CONFIRMING, TriggerSource.SHAKE);
        return true;
    }

    public synchronized VoiceCommand onSpeech(String transcript) {
        if (!voiceEnabled) return VoiceCommand.NONE;
        VoiceCommand command = phrases.classify(transcript, state);
        switch (command) {
            case TRIGGER -> {
                if (!acceptsNewSequence(TriggerSource.VOICE)) return VoiceCommand.NONE;
                if (voiceRequiresConfirmation) {
                    transition(TriggerState.CONFIRMING, TriggerSource.VOICE);
                } else {
                    source = TriggerSource.VOICE;
                    activate();
                }
            }
            case CANCEL -> cancel();
            case CONFIRM -> confirm();
            case NONE -> {}
        }
        return command;
    }

    // DEACTIVATED is published, then back to IDLE
    public synchronized boolean deactivate() {
        if (state != TriggerState.ACTIVATED) {
            return false;
        }
        TriggerSource was = source;
        transition(TriggerState.DEACTIVATED, was);
        try {
            handler.onDeactivated();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Deactivation handler failed");
        }
        progress = 0.0;
        elapsedSeconds = 0;
        transition(TriggerState.IDLE, null);
        return true;
    }

    public Subscription addListener(TriggerListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public synchronized TriggerState state() {
        return state;
    }

    public synchronized TriggerSource source() {
        return source;
    }

    public synchronized double progress() {
        return progress;
    }

    public synchronized int remainingSeconds() {
        return state == TriggerState.ARMING ? holdSeconds - elapsedSeconds : 0;
    }

    public boolean shakeEnabled() {
        return shakeEnabled;
    }

    public boolean voiceEnabled() {
        return voiceEnabled;
    }

    private boolean acceptsNewSequence(TriggerSource requested) {
        if (state == TriggerState.IDLE) return true;
        LOG.infof("Ignoring %s trigger, sequence already %s", requested, state);
        return false;
    }

    private void activate() {
        stopCountdown();
        transition(TriggerState.ACTIVATED, source);
        LOG.infof("SOS activated via %s", source);
        try {
            handler.onActivated(source);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Activation handler failed for %s trigger", source);
        }
    }

    private void scheduleTick() {
        long gen = generation;
        pendingTick = scheduler.schedule(TICK, () -> onTick(gen));
    }

    private synchronized void onTick(long gen) {
        if (gen != generation || state != TriggerState.ARMING) {
            return;
        }
        elapsedSeconds++;
        publishProgress(Math.min(1.0, (double) elapsedSeconds / holdSeconds));
        if (elapsedSeconds >= holdSeconds) {
            activate();
        } else {
            scheduleTick();
        }
    }

    private void stopCountdown() {
        generation++;
        if (pendingTick != null) {
            pendingTick.cancel();
            pendingTick = null;
        }
    }

    private void publishProgress(double value) {
        progress = value;
        for (TriggerListener l : listeners) {
            try {
                l.onProgress(value);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Trigger listener failed on progress");
            }
        }
    }

    private void transition(TriggerState next, TriggerSource nextSource) {
        TriggerState previous = state;
        state = next;
        source = nextSource;
        if (next == TriggerState.IDLE) {
            elapsedSeconds = 0;
            progress = 0.0;
        }
        for (TriggerListener l : listeners) {
            try {
                l.onStateChanged(previous, next, nextSource);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Trigger listener failed on %s -> %s", previous, next);
            }
        }
    }
}
