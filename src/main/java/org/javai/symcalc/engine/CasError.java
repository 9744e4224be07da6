package org.javai.symcalc.engine;

import java.util.Objects;
import java.util.Optional;
import org.javai.symcalc.math.EvaluationException;
import org.javai.symcalc.parse.ExprParseException;
import org.javai.symcalc.symbolic.TransformException;

/**
 * Describes why an engine operation failed.
 *
 * @param kind which stage failed
 * @param message human-readable description
 * @param position offset in the input text for parse errors, {@link #NO_POSITION} otherwise
 * @param evaluationKind the specific evaluation failure, null unless {@code kind} is EVALUATION
 */
public record CasError(Kind kind, String message, int position, EvaluationException.Kind evaluationKind) {

	public static final int NO_POSITION = -1;

	public enum Kind {
		PARSE,
		EVALUATION,
		TRANSFORM
	}

	public CasError {
		Objects.requireNonNull(kind, "kind must not be null");
		message = message != null ? message : "";
	}

	public static CasError parse(ExprParseException e) {
		return new CasError(Kind.PARSE, e.getMessage(), e.position(), null);
	}

	public static CasError evaluation(EvaluationException e) {
		return new CasError(Kind.EVALUATION, e.getMessage(), NO_POSITION, e.kind());
	}

	public static CasError transform(TransformException e) {
		return transform(e.getMessage());
	}

	public static CasError transform(String message) {
		return of(Kind.TRANSFORM, message);
	}

	public static CasError of(Kind kind, String message) {
		return new CasError(kind, message, NO_POSITION, null);
	}

	public boolean hasPosition() {
		return position != NO_POSITION;
	}

	public Optional<EvaluationException.Kind> evaluationFailure() {
		return Optional.ofNullable(evaluationKind);
	}

	@Override
	public String toString() {
		return kind + ": " + message;
	}
}
