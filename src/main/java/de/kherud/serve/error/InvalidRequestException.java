package de.kherud.serve.error;

public class InvalidRequestException extends PredictorException {

	private final ErrorKind kind;

	public InvalidRequestException(ErrorKind kind) {
		super(kind.getMessage());
		this.kind = kind;
	}

	public InvalidRequestException(ErrorKind kind, Throwable cause) {
		super(kind.getMessage(), cause);
		this.kind = kind;
	}

	public ErrorKind getKind() {
		return kind;
	}

	@Override
	public int getStatusCode() {
		return 400;
	}
}
