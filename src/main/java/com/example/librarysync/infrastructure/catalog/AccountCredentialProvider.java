package com.example.librarysync.infrastructure.catalog;

import com.example.librarysync.common.config.AppSecurityProperties;
import com.example.librarysync.common.util.AesCryptoUtil;
import com.example.librarysync.domain.model.CatalogCredentials;
import com.example.librarysync.infrastructure.persistence.entity.SyncAccountEntity;
import com.example.librarysync.infrastructure.persistence.mapper.SyncAccountMapper;
import org.springframework.stereotype.Component;

@Component
public class AccountCredentialProvider implements CredentialProvider {

    private final SyncAccountMapper syncAccountMapper;
    private final AppSecurityProperties appSecurityProperties;

    public AccountCredentialProvider(SyncAccountMapper syncAccountMapper,
                                     AppSecurityProperties appSecurityProperties) {
        this.syncAccountMapper = syncAccountMapper;
        this.appSecurityProperties = appSecurityProperties;
    }

    @Override
    public CatalogCredentials credentialsFor(Long accountId, String passwordEnc) {
        SyncAccountEntity account = syncAccountMapper.selectById(accountId);
        if (account == null) {
            throw new IllegalStateException("Sync account not found: " + accountId);
        }
        String cipherText = passwordEnc != null ? passwordEnc : account.getPasswordEnc();
        String password = AesCryptoUtil.decrypt(cipherText, appSecurityProperties.getEncryptKey());
        return new CatalogCredentials(account.getCatalogUsername(), password);
    }
}
