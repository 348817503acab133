package nl.vu.kai.ontostructure.classifier;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * {@link Classifier} backed by an ONNX model taking a {@code [1, 5]} float tensor. The confidence is
 * the second value of the first output, i.e. the probability of the "keep" class.
 */
public class OnnxClassifier implements Classifier, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OnnxClassifier.class);

    private final OrtEnvironment environment;
    private final OrtSession session;
    private final String inputName;

    private OnnxClassifier(OrtEnvironment environment, OrtSession session) {
        this.environment = environment;
        this.session = session;
        this.inputName = session.getInputNames().iterator().next();
    }

    public static OnnxClassifier load(Path modelPath) throws ClassifierUnavailableException {
        if (!Files.isReadable(modelPath))
            throw new ClassifierUnavailableException("No readable model at " + modelPath.toAbsolutePath());
        try {
            OrtEnvironment environment = OrtEnvironment.getEnvironment();
            OrtSession session = environment.createSession(modelPath.toString(), new OrtSession.SessionOptions());
            log.info("Loaded classifier {} (inputs {}, outputs {})", modelPath, session.getInputNames(), session.getOutputNames());
            return new OnnxClassifier(environment, session);
        } catch (OrtException e) {
            throw new ClassifierUnavailableException("Could not load model " + modelPath, e);
        }
    }

    @Override
    public double score(double[] features) throws ClassifierUnavailableException {
        Preconditions.checkArgument(features.length == FEATURES, "expected %s features, got %s", FEATURES, features.length);
        float[][] input = new float[1][FEATURES];
        for (int i = 0; i < FEATURES; i++)
            input[0][i] = (float) features[i];

        try (OnnxTensor tensor = OnnxTensor.createTensor(environment, input);
             OrtSession.Result result = session.run(Map.of(inputName, tensor))) {
            OnnxValue output = result.get(0);
            Object value = output.getValue();
            if (value instanceof float[][])
                return ((float[][]) value)[0][1];
            if (value instanceof float[])
                return ((float[]) value)[1];
            throw new ClassifierUnavailableException("Unexpected model output " + output.getInfo());
        } catch (OrtException e) {
            throw new ClassifierUnavailableException("Inference failed", e);
        }
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (OrtException e) {
            throw new IllegalStateException("Could not release the model session", e);
        }
    }
}
