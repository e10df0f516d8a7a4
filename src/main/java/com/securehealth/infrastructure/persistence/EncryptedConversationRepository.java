package com.securehealth.infrastructure.persistence;

import com.securehealth.domain.model.Conversation;
import com.securehealth.domain.repository.ConversationRepository;
import com.securehealth.domain.schema.ConversationSchema;
import com.securehealth.infrastructure.codec.DocumentCodec;
import com.securehealth.infrastructure.codec.EncryptedEqualityFilter;

public class EncryptedConversationRepository extends EncryptedRecordRepository<Conversation> implements ConversationRepository {

    public EncryptedConversationRepository(ConversationSchema schema, DocumentCodec codec,
                                  EncryptedEqualityFilter filters, DocumentStore store) {
        super(schema, codec, filters, store);
    }
}
