package com.securehealth.infrastructure.persistence;

import com.securehealth.domain.model.Message;
import com.securehealth.domain.repository.MessageRepository;
import com.securehealth.domain.schema.MessageSchema;
import com.securehealth.infrastructure.codec.DocumentCodec;
import com.securehealth.infrastructure.codec.EncryptedEqualityFilter;

public class EncryptedMessageRepository extends EncryptedRecordRepository<Message> implements MessageRepository {

    public EncryptedMessageRepository(MessageSchema schema, DocumentCodec codec,
                                  EncryptedEqualityFilter filters, DocumentStore store) {
        super(schema, codec, filters, store);
    }
}
