package com.raditha.unnest.refactoring;

import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Validates a candidate and repairs it until it is accepted, a repair is no longer possible,
 * or the configured number of attempts is used up.
 */
public class ValidationLoop {

    private static final Logger logger = LoggerFactory.getLogger(ValidationLoop.class);

    private final CandidateValidator validator;
    private final RepairHeuristics heuristics;

    public ValidationLoop(CandidateValidator validator, RepairHeuristics heuristics) {
        this.validator = validator;
        this.heuristics = heuristics;
    }

    /**
     * Final state of a candidate.
     *
     * @param accepted       whether the candidate passed validation
     * @param candidate      the last candidate validated
     * @param validation     its validation result
     * @param repairAttempts repairs applied
     * @param reason         why the candidate was rejected, null when accepted
     */
    public record Result(
            boolean accepted,
            RefactoringCandidate candidate,
            ValidationResult validation,
            int repairAttempts,
            String reason) {
    }

    public Result run(RefactoringCandidate produced, RegionContext context, RegionTransformer transformer) {
        int depthBefore = context.region().maxDepth();
        int threshold = context.config().depthThreshold();
        int maxAttempts = context.config().maxRepairAttempts();
        RefactoringCandidate candidate = produced;
        int repairs = 0;
        while (true) {
            ValidationResult validation = validator.validate(candidate, depthBefore, threshold);
            if (validation.valid()) {
                logger.debug("Candidate accepted after {} repairs, depth {} -> {}", repairs, depthBefore,
                        validation.depthAfter());
                return new Result(true, candidate, validation, repairs, null);
            }
            logger.debug("Candidate failed validation ({}): {}", validation.failure(), validation.error());

            if (validation.failure() == ValidationResult.Failure.DEPTH_NOT_REDUCED) {
                return new Result(false, candidate, validation, repairs, validation.error());
            }
            if (repairs >= maxAttempts) {
                return new Result(false, candidate, validation, repairs,
                        "repair attempts exhausted after " + repairs + ": " + validation.error());
            }
            Optional<RepairHeuristics.Repair> repair = heuristics.repair(candidate, validation, context, transformer);
            if (repair.isEmpty()) {
                return new Result(false, candidate, validation, repairs, "no repair applies: " + validation.error());
            }
            repairs++;
            logger.debug("Repair attempt {}: {}", repairs, repair.get().heuristic());
            candidate = repair.get().candidate();
        }
    }
}
