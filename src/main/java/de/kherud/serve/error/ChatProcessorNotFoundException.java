package de.kherud.serve.error;

/**
 * The configured chat processor does not exist. Raised while a deployment is being constructed;
 * the deployment refuses to start.
 */
public class ChatProcessorNotFoundException extends PredictorException {

	private final String processorName;

	public ChatProcessorNotFoundException(String deploymentName, String processorName) {
		super(deploymentName + " deployment failed. chat_processor(" + processorName + ") does not exist.");
		this.processorName = processorName;
	}

	public String getProcessorName() {
		return processorName;
	}
}
