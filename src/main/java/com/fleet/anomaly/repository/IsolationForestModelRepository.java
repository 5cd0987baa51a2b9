package com.fleet.anomaly.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleet.anomaly.model.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.Optional;

@Repository
public class IsolationForestModelRepository {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestModelRepository.class);

    private final ModelStore store;
    private final ObjectMapper objectMapper;

    public IsolationForestModelRepository(ModelStore store) {
        this.store = store;
        this.objectMapper = new ObjectMapper();
    }

    public void save(StoredModel model) {
        MessageType messageType = model.getMessageType();
        try {
            store.save(messageType, objectMapper.writeValueAsBytes(model));
        } catch (IOException e) {
            throw new ModelPersistenceException("Failed to save " + messageType.getArtifactName(), e);
        }
        log.info("Saved {} model: {} trees, {} samples",
                messageType.getWireName(), model.getForest().getTrees().size(), model.getTrainingSamples());
    }

    /**
     * @throws ModelPersistenceException if the artifact exists but cannot be read or decoded
     */
    public Optional<StoredModel> load(MessageType messageType) {
        try {
            Optional<byte[]> bytes = store.load(messageType);
            if (bytes.isEmpty()) {
                return Optional.empty();
            }
            StoredModel model = objectMapper.readValue(bytes.get(), StoredModel.class);
            if (model.getForest() == null || !model.getForest().isFitted()) {
                throw new ModelPersistenceException(
                        "Artifact " + messageType.getArtifactName() + " holds no fitted forest", null);
            }
            if (model.getMessageType() != null && model.getMessageType() != messageType) {
                throw new ModelPersistenceException("Artifact " + messageType.getArtifactName()
                        + " was trained for " + model.getMessageType().getWireName(), null);
            }
            return Optional.of(model);
        } catch (IOException e) {
            throw new ModelPersistenceException("Failed to load " + messageType.getArtifactName(), e);
        }
    }
}
