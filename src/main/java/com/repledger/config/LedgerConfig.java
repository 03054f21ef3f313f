package com.repledger.config;

import com.repledger.interest.InterestModel;
import com.repledger.interest.LinearInterestModel;
import com.repledger.ledger.LedgerParameters;
import com.repledger.proof.DigestProofVerifier;
import com.repledger.proof.ProofVerifier;
import com.repledger.reputation.ReputationHook;
import com.repledger.reputation.ReputationStore;
import com.repledger.reputation.ScoreReputationHook;
import com.repledger.risk.RiskParameters;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the ledger's parameter objects and pluggable modules from application.properties.
 *
 * <p>Defaults describe a permissive development setup: no fees, no bounty, no proof requirement.
 * Production values are set in application.properties or changed at runtime through the admin API.
 * Parameter beans are validated on creation, so an out-of-range property fails startup.
 *
 * <p>Properties prefix: {@code repledger.*}
 */
@Configuration
public class LedgerConfig {

    @Bean
    public LedgerParameters ledgerParameters(
            @Value("${repledger.ledger.ledger-account:ledger}") String ledgerAccount,
            @Value("${repledger.ledger.treasury-account:#{null}}") String treasuryAccount,
            @Value("${repledger.ledger.min-duration-seconds:86400}") long minDurationSeconds,
            @Value("${repledger.ledger.max-duration-seconds:31536000}") long maxDurationSeconds,
            @Value("${repledger.ledger.grace-period-seconds:259200}") long gracePeriodSeconds,
            @Value("${repledger.ledger.origination-fee-bps:0}") int originationFeeBps,
            @Value("${repledger.ledger.protocol-fee-bps:0}") int protocolFeeBps,
            @Value("${repledger.ledger.default-bounty-bps:0}") int defaultBountyBps) {
        LedgerParameters params = LedgerParameters.builder()
                .ledgerAccount(ledgerAccount)
                .treasuryAccount(treasuryAccount)
                .minDurationSeconds(minDurationSeconds)
                .maxDurationSeconds(maxDurationSeconds)
                .gracePeriodSeconds(gracePeriodSeconds)
                .originationFeeBps(originationFeeBps)
                .protocolFeeBps(protocolFeeBps)
                .defaultBountyBps(defaultBountyBps)
                .build();
        params.validate();
        return params;
    }

    @Bean
    public RiskParameters riskParameters(
            @Value("${repledger.risk.max-ratio-bps:15000}") int maxRatioBps,
            @Value("${repledger.risk.score-free:800}") int scoreFree,
            @Value("${repledger.risk.no-collateral-cap:0}") BigInteger noCollateralCap,
            @Value("${repledger.risk.proof-required:false}") boolean proofRequired,
            @Value("${repledger.risk.accepted-collateral-assets:}") Set<String> acceptedCollateralAssets) {
        RiskParameters params = RiskParameters.builder()
                .maxRatioBps(maxRatioBps)
                .scoreFree(scoreFree)
                .noCollateralCap(noCollateralCap)
                .proofRequired(proofRequired)
                .acceptedCollateralAssets(Set.copyOf(acceptedCollateralAssets))
                .build();
        params.validate();
        return params;
    }

    @Bean
    public InterestModel interestModel(
            @Value("${repledger.interest.apr-bps:1000}") int aprBps,
            @Value("${repledger.interest.penalty-apr-bps:2000}") int penaltyAprBps) {
        return new LinearInterestModel(aprBps, penaltyAprBps);
    }

    @Bean
    public ReputationHook reputationHook(
            Optional<ReputationStore> reputationStore,
            @Value("${repledger.reputation.score-increment:100}") int scoreIncrement,
            @Value("${repledger.reputation.max-score:1000}") int maxScore,
            @Value("${repledger.reputation.strict:false}") boolean strict) {
        return new ScoreReputationHook(reputationStore, scoreIncrement, maxScore, strict);
    }

    /** Only registered when a shared secret is configured; without it proofs cannot be verified. */
    @Bean
    @ConditionalOnExpression("!'${repledger.proof.secret:}'.isEmpty()")
    public ProofVerifier proofVerifier(@Value("${repledger.proof.secret}") String secret) {
        return new DigestProofVerifier(secret);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
