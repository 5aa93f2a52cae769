package com.example.sos.otp;

import com.example.sos.capabilities.ByteStore;
import com.example.sos.capabilities.CloudMessagingCapability;
import com.example.sos.contacts.ContactRoster;
import com.example.sos.error.StoreException;
import com.example.sos.model.OtpRecord;
import com.example.sos.scheduling.TaskScheduler;
import com.example.sos.serde.JsonCodec;
import com.example.sos.util.PhoneNumbers;
import jakarta.enterprise.context.ApplicationScoped;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class OtpService {

    static final String OTP_PREFIX = "otp_";
    static final String VERIFIED_PREFIX = "verified_";
    static final String COOLDOWN_PREFIX = "otp_cooldown_";

    private static final Logger LOG = Logger.getLogger(OtpService.class);

    private final ByteStore store;
    private final JsonCodec codec;
    private final CloudMessagingCapability messaging;
    private final ContactRoster roster;
    private final OtpCodeGenerator generator;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final int codeLength;
    private final Duration expiry;
    private final Duration cooldown;
    private final int maxAttempts;
    private final Duration successGrace;
    private final Duration sendTimeout;

    static final int LOCK_STRIPES = 64;

    // striped by phone number; the same number always maps to the same lock
    private final Object[] locks = new Object[LOCK_STRIPES];

    public OtpService(
        ByteStore store,
        JsonCodec codec,
        CloudMessagingCapability messaging,
        ContactRoster roster,
        OtpCodeGenerator generator,
        TaskScheduler scheduler,
        Clock clock,
        @ConfigProperty(name = "sos.otp.length", defaultValue = "6") int codeLength,
        @ConfigProperty(name = "sos.otp.expiry", defaultValue = "PT10M") Duration expiry,
        @ConfigProperty(name = "sos.otp.cooldown", defaultValue = "PT5M") Duration cooldown,
        @ConfigProperty(name = "sos.otp.max-attempts", defaultValue = "3") int maxAttempts,
        @ConfigProperty(
            name = "sos.otp.success-grace",
            defaultValue = "PT5S"
        ) Duration successGrace,
        @ConfigProperty(
            name = "sos.otp.send-timeout",
            defaultValue = "PT10S"
        ) Duration sendTimeout
    ) {
        this.store = store;
        this.codec = codec;
        this.messaging = messaging;
        this.roster = roster;
        this.generator = generator;
        this.scheduler = scheduler;
        this.clock = clock;
        this.codeLength = codeLength;
        this.expiry = expiry;
        this.cooldown = cooldown;
        this.maxAttempts = maxAttempts;
        this.successGrace = successGrace;
        this.sendTimeout = sendTimeout;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    public OtpResult send(String phoneNumber, OtpPurpose purpose) {
        if (!PhoneNumbers.isValid(phoneNumber)) {
            return OtpResult.failure(
                OtpStatus.INVALID_FORMAT,
                "Invalid phone number format. Use international format (e.g., +1234567890)"
            );
        }

        String code;
        Instant expiresAt;
        synchronized (lockFor(phoneNumber)) {
            Instant now = clock.instant();
            OtpResult limited = rateLimit(phoneNumber, now);
            if (limited != null) {
                return limited;
            }
            store.set(cooldownKey(phoneNumber), utf8(Long.toString(now.toEpochMilli())));

            code = generator.generate(codeLength);
            expiresAt = now.plus(expiry);
            OtpRecord record = new OtpRecord();
            record.phoneNumber = phoneNumber;
            record.code = code;
            record.createdAt = now;
            record.expiresAt = expiresAt;
            record.verified = false;
            record.attempts = 0;
            save(record);
        }

        deliverCode(phoneNumber, code, purpose);
        LOG.infof(
            "OTP issued for %s (%s), expires at %s",
            PhoneNumbers.mask(phoneNumber),
            purpose,
            expiresAt
        );
        return OtpResult.sent(
            "OTP sent to " + PhoneNumbers.mask(phoneNumber),
            expiresAt
        );
    }

    public OtpResult verify(String phoneNumber, String code) {
        if (!PhoneNumbers.isValid(phoneNumber)) {
            return OtpResult.failure(OtpStatus.INVALID_FORMAT, "Invalid phone number format");
        }
        OtpRecord verified;
        synchronized (lockFor(phoneNumber)) {
            OtpRecord record = load(phoneNumber);
            if (record == null) {
                return OtpResult.failure(
                    OtpStatus.NOT_FOUND,
                    "No OTP found. Please request a new one."
                );
            }
            if (record.verified) {
                // repeated verify inside the grace period
                return OtpResult.verified("Phone number already verified");
            }
            if (record.isExpired(clock.instant())) {
                cleanup(phoneNumber);
                return OtpResult.failure(
                    OtpStatus.EXPIRED,
                    "OTP has expired. Please request a new one."
                );
            }
            if (record.attempts >= maxAttempts) {
                cleanup(phoneNumber);
                return OtpResult.failure(
                    OtpStatus.ATTEMPTS_EXCEEDED,
                    "Maximum verification attempts exceeded. Please request a new OTP."
                );
            }
            if (!matches(record.code, code)) {
                record.attempts++;
                int remaining = Math.max(0, maxAttempts - record.attempts);
                if (remaining == 0) {
                    cleanup(phoneNumber);
                    LOG.warnf(
                        "OTP for %s exhausted after %d attempts",
                        PhoneNumbers.mask(phoneNumber),
                        record.attempts
                    );
                } else {
                    save(record);
                }
                return OtpResult.invalidCode(
                    "Invalid OTP. %d attempts remaining.".formatted(remaining),
                    remaining
                );
            }

            record.verified = true;
            save(record);
            store.set(verifiedKey(phoneNumber), utf8("true"));
            verified = record;
        }

        scheduleCleanup(verified);
        promoteContacts(phoneNumber);
        LOG.infof("Phone %s verified", PhoneNumbers.mask(phoneNumber));
        return OtpResult.verified("Phone number verified successfully!");
    }

    public boolean isVerified(String phoneNumber) {
        byte[] flag = store.get(verifiedKey(phoneNumber));
        return flag != null && "true".equals(new String(flag, StandardCharsets.UTF_8));
    }

    // inside the cooldown nothing changes and the pending code stays usable
    public OtpResult resend(String phoneNumber, OtpPurpose purpose) {
        if (PhoneNumbers.isValid(phoneNumber)) {
            synchronized (lockFor(phoneNumber)) {
                OtpResult limited = rateLimit(phoneNumber, clock.instant());
                if (limited != null) {
                    return limited;
                }
                cleanup(phoneNumber);
            }
        }
        return send(phoneNumber, purpose);
    }

    public void clearVerification(String phoneNumber) {
        synchronized (lockFor(phoneNumber)) {
            store.delete(verifiedKey(phoneNumber));
            cleanup(phoneNumber);
        }
    }

    private void deliverCode(String phoneNumber, String code, OtpPurpose purpose) {
        if (!messaging.available()) {
            LOG.warnf(
                "Messaging unavailable, OTP for %s stored but not delivered",
                PhoneNumbers.mask(phoneNumber)
            );
            return;
        }
        Map<String, String> params = Map.of(
            "template", "otp",
            "code", code,
            "purpose", purpose.name().toLowerCase(Locale.ROOT),
            "expiryMinutes", Long.toString(expiry.toMinutes())
        );
        try {
            messaging
                .send(phoneNumber, params)
                .toCompletableFuture()
                .orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((r, e) -> {
                    if (e != null) {
                        LOG.warnf(
                            "OTP delivery to %s failed: %s",
                            PhoneNumbers.mask(phoneNumber),
                            e.getMessage()
                        );
                    } else if (!r.success()) {
                        LOG.warnf(
                            "OTP delivery to %s rejected: %s",
                            PhoneNumbers.mask(phoneNumber),
                            r.error()
                        );
                    }
                });
        } catch (RuntimeException e) {
            LOG.errorf(e, "OTP delivery to %s failed", PhoneNumbers.mask(phoneNumber));
        }
    }

    private void scheduleCleanup(OtpRecord verified) {
        scheduler.schedule(
            successGrace,
            () -> {
                synchronized (lockFor(verified.phoneNumber)) {
                    OtpRecord current = load(verified.phoneNumber);
                    // a newer code may have been issued meanwhile
                    if (current != null && current.createdAt.equals(verified.createdAt)) {
                        cleanup(verified.phoneNumber);
                    }
                }
            }
        );
    }

    private void promoteContacts(String phoneNumber) {
        try {
            roster.markVerified(phoneNumber);
        } catch (RuntimeException e) {
            LOG.errorf(
                e,
                "Could not promote contacts for %s, verified flag kept",
                PhoneNumbers.mask(phoneNumber)
            );
        }
    }

    private OtpResult rateLimit(String phoneNumber, Instant now) {
        Duration wait = cooldownRemaining(phoneNumber, now);
        if (wait.isZero()) {
            return null;
        }
        long minutes = (wait.toSeconds() + 59) / 60;
        LOG.infof(
            "OTP for %s rate limited for another %d s",
            PhoneNumbers.mask(phoneNumber),
            wait.toSeconds()
        );
        return OtpResult.rateLimited(
            "Please wait %d minute(s) before requesting another OTP".formatted(minutes),
            wait
        );
    }

    private Duration cooldownRemaining(String phoneNumber, Instant now) {
        byte[] raw = store.get(cooldownKey(phoneNumber));
        if (raw == null) return Duration.ZERO;
        long last;
        try {
            last = Long.parseLong(new String(raw, StandardCharsets.UTF_8));
        } catch (NumberFormatException e) {
            LOG.warnf("Ignoring unreadable OTP cooldown for %s", PhoneNumbers.mask(phoneNumber));
            return Duration.ZERO;
        }
        Duration elapsed = Duration.between(Instant.ofEpochMilli(last), now);
        return elapsed.compareTo(cooldown) >= 0 ? Duration.ZERO : cooldown.minus(elapsed);
    }

    private OtpRecord load(String phoneNumber) {
        byte[] raw = store.get(otpKey(phoneNumber));
        if (raw == null) return null;
        try {
            return codec.read(raw, OtpRecord.class);
        } catch (StoreException e) {
            LOG.errorf(e, "Discarding unreadable OTP record for %s", PhoneNumbers.mask(phoneNumber));
            store.delete(otpKey(phoneNumber));
            return null;
        }
    }

    private void save(OtpRecord record) {
        store.set(otpKey(record.phoneNumber), codec.write(record));
    }

    private void cleanup(String phoneNumber) {
        store.delete(otpKey(phoneNumber));
    }

    Object lockFor(String phoneNumber) {
        return locks[Math.floorMod(phoneNumber.hashCode(), LOCK_STRIPES)];
    }

    private static boolean matches(String expected, String submitted) {
        if (submitted == null) return false;
        return MessageDigest.isEqual(utf8(expected), utf8(submitted));
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    static String otpKey(String phoneNumber) {
        return OTP_PREFIX + phoneNumber;
    }

    static String verifiedKey(String phoneNumber) {
        return VERIFIED_PREFIX + phoneNumber;
    }

    static String cooldownKey(String phoneNumber) {
        return COOLDOWN_PREFIX + phoneNumber;
    }
}
