package com.promptroute.infrastructure.repository.routing;

import com.promptroute.domain.routing.adapter.repository.IPromptEventRepository;
import com.promptroute.domain.routing.model.entity.PromptEventEntity;
import com.promptroute.domain.routing.model.valobj.PromptFeatures;
import com.promptroute.infrastructure.dao.PromptEventDao;
import com.promptroute.infrastructure.dao.po.PromptEventPO;
import com.promptroute.infrastructure.util.JsonCodec;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

/**
 * Prompt 事件仓储实现。特征以 JSON 列保存，原文不落库。
 */
@Repository
public class PromptEventRepositoryImpl implements IPromptEventRepository {

    private final PromptEventDao promptEventDao;
    private final JsonCodec jsonCodec;

    public PromptEventRepositoryImpl(PromptEventDao promptEventDao, JsonCodec jsonCodec) {
        this.promptEventDao = promptEventDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public PromptEventEntity save(PromptEventEntity entity) {
        entity.validate();
        PromptEventPO po = toPO(entity);
        promptEventDao.insert(po);
        return toEntity(po);
    }

    @Override
    public PromptEventEntity findById(Long id) {
        PromptEventPO po = promptEventDao.selectById(id);
        return po == null ? null : toEntity(po);
    }

    private PromptEventEntity toEntity(PromptEventPO po) {
        PromptEventEntity entity = new PromptEventEntity();
        entity.setId(po.getId());
        entity.setOrganization(po.getOrganization());
        entity.setUser(po.getUserKey());
        entity.setFeatures(jsonCodec.readValue(po.getFeatures(), PromptFeatures.class));
        entity.setContentHash(po.getContentHash());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private PromptEventPO toPO(PromptEventEntity entity) {
        return PromptEventPO.builder()
                .id(entity.getId())
                .organization(entity.getOrganization())
                .userKey(StringUtils.defaultString(entity.getUser()))
                .features(jsonCodec.writeValue(entity.getFeatures()))
                .contentHash(entity.getContentHash())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
