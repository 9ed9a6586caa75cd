package com.github.raff.webhook.merchant;

import com.github.raff.webhook.domain.model.Merchant;
import com.github.raff.webhook.domain.model.Platform;
import com.github.raff.webhook.domain.store.MerchantRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RepositoryMerchantDirectoryTest {

    @Mock
    private MerchantRepository repository;

    @InjectMocks
    private RepositoryMerchantDirectory directory;

    @Test
    void resolvesByPlatformColumn() {
        Merchant salla = Merchant.builder().id("M1").sallaStoreId("S1").build();
        Merchant zid = Merchant.builder().id("M2").zidStoreId("Z1").build();
        when(repository.findBySallaStoreId("S1")).thenReturn(Mono.just(salla));
        when(repository.findByZidStoreId("Z1")).thenReturn(Mono.just(zid));

        StepVerifier.create(directory.findByExternalStoreId(Platform.SALLA, "S1")).expectNext(salla).verifyComplete();
        StepVerifier.create(directory.findByExternalStoreId(Platform.ZID, "Z1")).expectNext(zid).verifyComplete();
    }

    @Test
    void blankStoreIdIsEmpty() {
        StepVerifier.create(directory.findByExternalStoreId(Platform.SALLA, " ")).verifyComplete();
        verifyNoInteractions(repository);
    }
}
