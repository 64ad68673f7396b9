package com.phonepe.triplestore.embedding;

import ai.djl.huggingface.translator.TextEmbeddingTranslatorFactory;
import ai.djl.inference.Predictor;
import ai.djl.repository.zoo.Criteria;
import ai.djl.repository.zoo.ZooModel;
import ai.djl.training.util.ProgressBar;
import com.phonepe.triplestore.core.embedding.TextEmbedder;
import com.phonepe.triplestore.core.errors.EmbeddingFailure;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.DestroyMode;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.commons.pool2.impl.GenericObjectPool;

import java.util.List;
import java.util.Objects;

/**
 * Embeds text with a local sentence-transformer model. The model is downloaded on first use.
 * Check <a href="https://docs.djl.ai/master/docs/load_model.html">...</a> for more information on how to load models
 */
@Slf4j
public class HuggingfaceTextEmbedder implements TextEmbedder {
    public static final String DEFAULT_MODEL_URL =
            "djl://ai.djl.huggingface.pytorch/sentence-transformers/all-MiniLM-L6-v2";

    private final String modelUrl;
    private final ZooModel<String, float[]> zooModel;
    // The pool is needed as predictor is not threadsafe
    private final GenericObjectPool<Predictor<String, float[]>> predictors;

    public HuggingfaceTextEmbedder() {
        this(null);
    }

    @Builder
    public HuggingfaceTextEmbedder(String modelUrl) {
        this.modelUrl = Objects.requireNonNullElse(modelUrl, DEFAULT_MODEL_URL);
        System.setProperty("OPT_OUT_TRACKING", "true"); //DJL DIALS HOME ...

        final var criteria = Criteria.builder()
                .setTypes(String.class, float[].class)
                .optModelUrls(this.modelUrl)
                .optEngine("PyTorch")
                .optTranslatorFactory(new TextEmbeddingTranslatorFactory())
                .optProgress(new ProgressBar())
                .build();
        try {
            this.zooModel = criteria.loadModel();
        }
        catch (Exception e) {
            throw new EmbeddingFailure("could not load model %s: %s".formatted(this.modelUrl, e.getMessage()), e);
        }
        this.predictors = new GenericObjectPool<>(new PredictorFactory(zooModel));
        log.info("Loaded embedding model {}", this.modelUrl);
    }

    @Override
    public float[] embed(String text) {
        return withPredictor(predictor -> predictor.predict(text));
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        return withPredictor(predictor -> predictor.batchPredict(texts));
    }

    @Override
    public void close() {
        predictors.close();
        zooModel.close();
    }

    @FunctionalInterface
    private interface Prediction<T> {
        T run(Predictor<String, float[]> predictor) throws Exception;
    }

    private <T> T withPredictor(final Prediction<T> prediction) {
        final Predictor<String, float[]> predictor;
        try {
            predictor = predictors.borrowObject();
        }
        catch (Exception e) {
            throw new EmbeddingFailure("no predictor available for " + modelUrl, e);
        }
        try {
            return prediction.run(predictor);
        }
        catch (Exception e) {
            throw new EmbeddingFailure("model %s failed: %s".formatted(modelUrl, e.getMessage()), e);
        }
        finally {
            predictors.returnObject(predictor);
        }
    }

    @RequiredArgsConstructor
    private static final class PredictorFactory extends BasePooledObjectFactory<Predictor<String, float[]>> {

        private final ZooModel<String, float[]> zooModel;

        @Override
        public Predictor<String, float[]> create() {
            log.debug("Creating new predictor");
            return zooModel.newPredictor();
        }

        @Override
        public PooledObject<Predictor<String, float[]>> wrap(Predictor<String, float[]> predictor) {
            return new DefaultPooledObject<>(predictor);
        }

        @Override
        public void destroyObject(PooledObject<Predictor<String, float[]>> predictor, DestroyMode destroyMode) {
            log.debug("Closing predictor");
            predictor.getObject().close();
        }
    }
}
