package dev.newsroom.config;

import dev.newsroom.entity.NewRecordAware;
import org.reactivestreams.Publisher;
import org.springframework.data.r2dbc.mapping.event.AfterConvertCallback;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Entities carry pre-assigned ids, so R2DBC cannot tell new from loaded rows by id.
 * Anything read back from the database is marked as existing; a later save() updates it.
 */
@Component
public class PersistableEntityCallback implements AfterConvertCallback<Object> {

    @Override
    public Publisher<Object> onAfterConvert(Object entity, SqlIdentifier table) {
        if (entity instanceof NewRecordAware loaded) {
            loaded.setNewRecord(false);
        }
        return Mono.just(entity);
    }
}
