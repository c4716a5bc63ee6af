package eu.virtualparadox.ragqa.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import eu.virtualparadox.ragqa.exception.EmbeddingUnavailableException;
import eu.virtualparadox.ragqa.exception.InvalidConfigurationException;
import eu.virtualparadox.ragqa.ingest.model.Chunk;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentence-transformer embeddings (e.g. all-MiniLM-L6-v2 exported to ONNX) computed in-process.
 * <p>Token vectors are mean-pooled over the attention mask and L2-normalized, so cosine similarity
 * equals the dot product.</p>
 */
@Service
public final class OnnxEmbeddingService implements EmbeddingService {

    private static final Logger logger = LoggerFactory.getLogger(OnnxEmbeddingService.class);

    private final Path modelPath;
    private final Path tokenizerPath;
    private final int batchSize;
    private final int maxTokens;
    private final int intraOpThreads;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingService(final ApplicationConfig config) {
        if (config.getModels() == null) {
            throw new InvalidConfigurationException("ragqa.models must point to the ONNX model folder");
        }
        final Path retrieverModelRoot = config.getModels().resolve("retriever");
        this.modelPath = retrieverModelRoot.resolve("model.onnx");
        this.tokenizerPath = retrieverModelRoot.resolve("tokenizer.json");
        this.batchSize = config.getEmbedding().getBatchSize();
        this.maxTokens = config.getEmbedding().getMaxTokens();
        this.intraOpThreads = config.getEmbedding().getIntraOpThreads();
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        this.env = OrtEnvironment.getEnvironment();
        this.session = env.createSession(modelPath.toString(), sessionOptions());
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        logger.info("Loaded ONNX embedding model: {}", modelPath);
        logger.info("Model expects inputs: {}", session.getInputNames());
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (tokenizer != null) {
            tokenizer.close();
        }
        if (session != null) {
            session.close();
        }
    }

    @Override
    public List<float[]> embed(final List<Chunk> chunks) {
        final List<float[]> result = new ArrayList<>(chunks.size());
        for (int from = 0; from < chunks.size(); from += batchSize) {
            final List<String> texts = new ArrayList<>();
            for (final Chunk chunk : chunks.subList(from, Math.min(from + batchSize, chunks.size()))) {
                texts.add(chunk.text());
            }
            result.addAll(embedBatch(texts));
        }
        logger.debug("Embedded {} chunks", chunks.size());
        return result;
    }

    @Override
    public float[] embedQuery(final String text) {
        return embedBatch(List.of(text)).get(0);
    }

    private List<float[]> embedBatch(final List<String> texts) {
        try {
            final List<Encoding> encodings = new ArrayList<>();
            int maxLen = 0;

            for (final String text : texts) {
                final Encoding e = tokenizer.encode(text);
                encodings.add(e);
                maxLen = Math.max(maxLen, e.getIds().length);
            }
            if (maxLen > maxTokens) {
                maxLen = maxTokens;
            }

            final int size = encodings.size();
            final long[][] inputIdArr = new long[size][maxLen];
            final long[][] attnMaskArr = new long[size][maxLen];
            final long[][] tokenTypeArr = new long[size][maxLen];

            for (int i = 0; i < size; i++) {
                final long[] ids = encodings.get(i).getIds();
                final long[] mask = encodings.get(i).getAttentionMask();
                final int len = Math.min(ids.length, maxLen);

                System.arraycopy(ids, 0, inputIdArr[i], 0, len);
                System.arraycopy(mask, 0, attnMaskArr[i], 0, len);
            }

            try (final OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
                 final OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
                 final OnnxTensor tokenTypeTensor = OnnxTensor.createTensor(env, tokenTypeArr)) {

                final Map<String, OnnxTensor> inputs = new HashMap<>();
                if (session.getInputNames().contains("input_ids")) {
                    inputs.put("input_ids", inputIds);
                }
                if (session.getInputNames().contains("attention_mask")) {
                    inputs.put("attention_mask", attentionMask);
                }
                if (session.getInputNames().contains("token_type_ids")) {
                    inputs.put("token_type_ids", tokenTypeTensor);
                }

                try (final OrtSession.Result result = session.run(inputs)) {
                    final float[][][] embeddings = (float[][][]) result.get(0).getValue();

                    final List<float[]> out = new ArrayList<>(size);
                    for (int i = 0; i < size; i++) {
                        final float[] vec = meanPool(embeddings[i], attnMaskArr[i]);
                        normalize(vec);
                        out.add(vec);
                    }
                    return out;
                }
            }
        } catch (final Exception e) {
            throw new EmbeddingUnavailableException("Failed to embed batch of " + texts.size() + " texts", e);
        }
    }

    private OrtSession.SessionOptions sessionOptions() throws OrtException {
        final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

        // leave one core free for other tasks
        final int intraThreads = intraOpThreads > 0
                ? intraOpThreads
                : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

        opts.setIntraOpNumThreads(intraThreads);
        opts.setInterOpNumThreads(1);

        logger.info("Intra-op threads: {}, Inter-op threads: {}", intraThreads, 1);
        return opts;
    }

    /**
     * Averages the token vectors whose attention mask is set.
     *
     * @param tokenVectors  per-token hidden states
     * @param attentionMask 1 for real tokens, 0 for padding
     * @return pooled vector (all zeros if no token is attended)
     */
    static float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length && i < attentionMask.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }

    static void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }
}
