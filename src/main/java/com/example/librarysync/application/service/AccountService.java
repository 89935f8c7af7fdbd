package com.example.librarysync.application.service;

import com.example.librarysync.api.request.CreateAccountRequest;
import com.example.librarysync.api.response.AccountResponse;
import com.example.librarysync.common.config.AppSecurityProperties;
import com.example.librarysync.common.util.AesCryptoUtil;
import com.example.librarysync.infrastructure.persistence.entity.SyncAccountEntity;
import com.example.librarysync.infrastructure.persistence.mapper.SyncAccountMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final SyncAccountMapper syncAccountMapper;
    private final AppSecurityProperties appSecurityProperties;

    public AccountService(SyncAccountMapper syncAccountMapper, AppSecurityProperties appSecurityProperties) {
        this.syncAccountMapper = syncAccountMapper;
        this.appSecurityProperties = appSecurityProperties;
    }

    @Transactional(rollbackFor = Exception.class)
    public AccountResponse register(CreateAccountRequest request) {
        SyncAccountEntity entity = new SyncAccountEntity();
        entity.setName(request.getName().trim());
        entity.setCatalogUsername(request.getCatalogUsername().trim());
        entity.setPasswordEnc(AesCryptoUtil.encrypt(request.getCatalogPassword(), appSecurityProperties.getEncryptKey()));
        entity.setEnabled(request.getEnabled() == null || request.getEnabled());
        syncAccountMapper.insert(entity);
        log.info("SYNC_ACCOUNT_REGISTERED accountId={} name={} enabled={}",
                entity.getId(), entity.getName(), entity.getEnabled());
        return new AccountResponse(entity.getId(), entity.getName(), entity.getCatalogUsername(), entity.getEnabled());
    }
}
