package com.ledgerly.backend.classification.model;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerly.backend.classification.model.CategoryModelArtifact.ClassifierState;
import com.ledgerly.backend.classification.model.CategoryModelArtifact.VectorizerState;
import com.ledgerly.backend.config.CategorizerProperties;
import com.ledgerly.backend.exceptions.CategoryModelException;

import lombok.extern.slf4j.Slf4j;
import weka.classifiers.Classifier;
import weka.core.Attribute;
import weka.core.Instances;
import weka.core.SerializationHelper;

/**
 * Reads and writes the categorizer artifact as a single JSON document.
 *
 * The classifier payload carries the Weka training header next to the classifier; loading rejects
 * artifacts whose vocabulary or categories disagree with it.
 *
 * Writes go to a sibling temp file that is then moved over the target, so a reader never sees a
 * half-written artifact.
 */
@Component
@Slf4j
public class CategoryModelStore {

    static final String ENCODING = "java-serialized+base64";

    private final ObjectMapper objectMapper;
    private final Path path;

    public CategoryModelStore(ObjectMapper objectMapper, CategorizerProperties properties) {
        this.objectMapper = objectMapper;
        this.path = Paths.get(properties.modelPath());
    }

    public Path path() {
        return path;
    }

    /**
     * @return empty when no artifact exists yet
     * @throws CategoryModelException when the artifact is unreadable, corrupt or of another schema version
     */
    public Optional<CategoryModel> load() {
        if (!Files.exists(path)) {
            log.info("[CategoryModelStore] No artifact at {}", path);
            return Optional.empty();
        }

        CategoryModelArtifact artifact;
        try {
            artifact = objectMapper.readValue(path.toFile(), CategoryModelArtifact.class);
        } catch (IOException e) {
            throw new CategoryModelException("Unreadable categorizer artifact: " + path, e);
        }
        if (artifact == null) {
            throw new CategoryModelException("Empty categorizer artifact: " + path);
        }
        if (artifact.schemaVersion() != CategoryModel.SCHEMA_VERSION) {
            throw new CategoryModelException("Incompatible artifact schema version " + artifact.schemaVersion()
                    + " (expected " + CategoryModel.SCHEMA_VERSION + ")");
        }

        CategoryModel model = fromArtifact(artifact);
        log.info("[CategoryModelStore] Loaded categorizer from {} (trainedAt={}, terms={}, categories={})",
                path, model.trainedAt(), model.vectorizer().size(), model.classLabels().size());
        return Optional.of(model);
    }

    public void save(CategoryModel model) {
        CategoryModelArtifact artifact = toArtifact(model);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), artifact);
                moveIntoPlace(tmp);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new CategoryModelException("Failed to write categorizer artifact: " + path, e);
        }
        log.info("[CategoryModelStore] Saved categorizer to {}", path);
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("[CategoryModelStore] Atomic move unsupported, falling back to replace");
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    CategoryModelArtifact toArtifact(CategoryModel model) {
        TfidfVectorizer vectorizer = model.vectorizer();
        List<Double> idf = Arrays.stream(vectorizer.idf()).boxed().toList();

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try {
            SerializationHelper.writeAll(bytes, new Object[] {model.classifier(), model.header()});
        } catch (Exception e) {
            throw new CategoryModelException("Failed to serialize classifier", e);
        }

        return new CategoryModelArtifact(
                model.schemaVersion(),
                model.trainedAt().toString(),
                model.holdoutAccuracy(),
                model.classLabels(),
                new VectorizerState(TfidfVectorizer.NGRAM_MIN, TfidfVectorizer.NGRAM_MAX,
                        vectorizer.vocabulary(), idf),
                new ClassifierState(model.classifier().getClass().getName(), ENCODING,
                        Base64.getEncoder().encodeToString(bytes.toByteArray()))
        );
    }

    CategoryModel fromArtifact(CategoryModelArtifact artifact) {
        VectorizerState vs = artifact.vectorizer();
        ClassifierState cs = artifact.classifier();
        if (vs == null || cs == null || artifact.classLabels() == null || artifact.classLabels().isEmpty()) {
            throw new CategoryModelException("Categorizer artifact is missing required sections");
        }
        if (vs.ngramMin() != TfidfVectorizer.NGRAM_MIN || vs.ngramMax() != TfidfVectorizer.NGRAM_MAX) {
            throw new CategoryModelException("Unsupported n-gram range " + vs.ngramMin() + ".." + vs.ngramMax());
        }
        if (!ENCODING.equals(cs.encoding()) || cs.payload() == null) {
            throw new CategoryModelException("Unsupported classifier encoding: " + cs.encoding());
        }
        if (vs.vocabulary() == null || vs.idf() == null) {
            throw new CategoryModelException("Vectorizer state is incomplete");
        }

        try {
            double[] idf = vs.idf().stream().mapToDouble(Double::doubleValue).toArray();
            TfidfVectorizer vectorizer = TfidfVectorizer.restore(vs.vocabulary(), idf);

            byte[] payload = Base64.getDecoder().decode(cs.payload());
            Object[] restored = SerializationHelper.readAll(new ByteArrayInputStream(payload));
            if (restored.length < 2 || !(restored[0] instanceof Classifier classifier)
                    || !(restored[1] instanceof Instances trainedHeader)) {
                throw new CategoryModelException("Artifact payload is not a Weka classifier with its training header");
            }
            checkCompatible(trainedHeader, vs.vocabulary(), artifact.classLabels());

            Instant trainedAt = artifact.trainedAt() != null ? Instant.parse(artifact.trainedAt()) : null;
            CategoryModel model = new CategoryModel(vectorizer, classifier, artifact.classLabels(), trainedAt,
                    artifact.holdoutAccuracy());
            model.predict("", 0.0);
            return model;
        } catch (CategoryModelException e) {
            throw e;
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new CategoryModelException("Malformed categorizer artifact", e);
        } catch (Exception e) {
            throw new CategoryModelException("Failed to restore classifier", e);
        }
    }

    /**
     * The classifier only scores instances shaped like its training data: one attribute per
     * vocabulary term, the amount, then the class with the same labels in the same order.
     */
    static void checkCompatible(Instances trainedHeader, List<String> vocabulary, List<String> classLabels) {
        int expectedAttributes = vocabulary.size() + 2;
        if (trainedHeader.numAttributes() != expectedAttributes) {
            throw new CategoryModelException("Vocabulary of " + vocabulary.size()
                    + " terms does not match classifier trained on " + (trainedHeader.numAttributes() - 2) + " features");
        }
        if (trainedHeader.classIndex() < 0) {
            throw new CategoryModelException("Classifier training header has no class attribute");
        }
        Attribute classAttribute = trainedHeader.classAttribute();
        if (classAttribute.numValues() != classLabels.size()) {
            throw new CategoryModelException("Artifact lists " + classLabels.size()
                    + " categories but classifier predicts " + classAttribute.numValues());
        }
        for (int i = 0; i < classLabels.size(); i++) {
            if (!classAttribute.value(i).equals(classLabels.get(i))) {
                throw new CategoryModelException("Category " + i + " is '" + classLabels.get(i)
                        + "' in the artifact but '" + classAttribute.value(i) + "' in the classifier");
            }
        }
    }
}
