package com.example.librarysync.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.example.librarysync.api.request.CreateAccountRequest;
import com.example.librarysync.api.response.AccountResponse;
import com.example.librarysync.common.config.AppSecurityProperties;
import com.example.librarysync.common.util.AesCryptoUtil;
import com.example.librarysync.infrastructure.persistence.entity.SyncAccountEntity;
import com.example.librarysync.infrastructure.persistence.mapper.SyncAccountMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class AccountServiceTest {

    private static final String KEY = "0123456789abcdef";

    @Test
    void shouldStoreEncryptedPassword() {
        SyncAccountMapper mapper = mock(SyncAccountMapper.class);
        doAnswer(invocation -> {
            SyncAccountEntity entity = invocation.getArgument(0);
            entity.setId(42L);
            return 1;
        }).when(mapper).insert(any(SyncAccountEntity.class));
        AppSecurityProperties properties = new AppSecurityProperties();
        properties.setEncryptKey(KEY);
        AccountService service = new AccountService(mapper, properties);

        CreateAccountRequest request = new CreateAccountRequest();
        request.setName(" home ");
        request.setCatalogUsername("alice@example.com");
        request.setCatalogPassword("pw-123");
        request.setEnabled(false);
        AccountResponse response = service.register(request);

        ArgumentCaptor<SyncAccountEntity> captor = ArgumentCaptor.forClass(SyncAccountEntity.class);
        verify(mapper).insert(captor.capture());
        SyncAccountEntity saved = captor.getValue();
        assertNotEquals("pw-123", saved.getPasswordEnc());
        assertEquals("pw-123", AesCryptoUtil.decrypt(saved.getPasswordEnc(), KEY));
        assertEquals(42L, response.getId().longValue());
        assertEquals("home", response.getName());
        assertFalse(response.getEnabled());
    }
}
