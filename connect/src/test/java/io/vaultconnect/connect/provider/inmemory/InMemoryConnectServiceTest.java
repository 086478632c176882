/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.provider.inmemory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.vaultconnect.connect.model.Category;
import io.vaultconnect.connect.model.Field;
import io.vaultconnect.connect.model.FieldPurpose;
import io.vaultconnect.connect.model.FullItem;
import io.vaultconnect.connect.model.Item;
import io.vaultconnect.connect.model.ItemBuilder;
import io.vaultconnect.connect.model.Vault;
import io.vaultconnect.connect.service.ConnectException;
import io.vaultconnect.connect.service.ErrorResponse;
import io.vaultconnect.connect.service.ItemFilter;
import io.vaultconnect.connect.service.TitleResolver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryConnectServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    InMemoryConnectService service;
    InMemoryConnect connect;
    Vault vault;

    @BeforeEach
    public void before() {
        service = InMemoryConnectService.newInstance();
        connect = service.buildConnect(new InMemoryConnectService.Config(Clock.fixed(NOW, ZoneOffset.UTC)));
        vault = connect.createVault("Demo");
    }

    @Test
    void shouldBeDiscoverable() {
        assertNotNull(service);
        assertThat(service.buildConnect(new InMemoryConnectService.Config())).isNotNull();
    }

    @Test
    void shouldRejectNullClock() {
        assertThrows(NullPointerException.class, () -> new InMemoryConnectService.Config(null));
    }

    @Test
    void shouldListAndGetVaults() throws Exception {
        // given
        await(connect.createItem(vault.id(), login("Email")));

        // when
        var vaults = await(connect.listVaults());
        var fetched = await(connect.getVault(vault.id()));

        // then
        assertThat(vaults).extracting(Vault::id).containsExactly(vault.id());
        assertThat(fetched.name()).isEqualTo("Demo");
        assertThat(fetched.items()).isEqualTo(1);
    }

    @Test
    void shouldFailToGetUnknownVault() {
        var e = failure(connect.getVault("nope"));

        assertEquals(new ErrorResponse(404, InMemoryConnect.VAULT_NOT_FOUND), e.errorResponse());
    }

    @Test
    void shouldShareVaultsBetweenConnectsOfOneService() throws Exception {
        var other = service.buildConnect(new InMemoryConnectService.Config());

        assertThat(await(other.getVault(vault.id())).id()).isEqualTo(vault.id());
    }

    @Test
    void shouldNotShareVaultsBetweenServices() {
        var other = InMemoryConnectService.newInstance().buildConnect(new InMemoryConnectService.Config());

        assertThat(failure(other.getVault(vault.id())).status()).isEqualTo(404);
    }

    @Test
    void shouldCreateItem() throws Exception {
        // given
        var item = new ItemBuilder()
                .setCategory(Category.LOGIN)
                .setTitle("Bank of Example")
                .addField(Field.builder().label("username").value("jdoe").purpose(FieldPurpose.USERNAME).build())
                .build();

        // when
        var created = await(connect.createItem(vault.id(), item));

        // then
        assertThat(created.id()).isNotNull();
        assertThat(created.vault()).isEqualTo(vault.ref());
        assertThat(created.version()).isEqualTo(1);
        assertThat(created.createdAt()).isEqualTo(NOW);
        assertThat(created.updatedAt()).isEqualTo(NOW);
        assertThat(created.fields()).singleElement()
                .satisfies(field -> {
                    assertThat(field.id()).isNotNull();
                    assertThat(field.value()).isEqualTo("jdoe");
                });
        assertThat(await(connect.getItem(vault.id(), created.id()))).isEqualTo(created);
    }

    @Test
    void shouldRejectCreateOfItemWithId() {
        var item = new Item("existing", "Email", null, Category.LOGIN, null, false, null, null, null, 0, false, null, null, null);

        var e = failure(connect.createItem(vault.id(), item));

        assertThat(e.status()).isEqualTo(400);
    }

    @Test
    void shouldRejectCreateInUnknownVault() {
        var e = failure(connect.createItem("nope", login("Email")));

        assertThat(e.errorResponse().message()).isEqualTo(InMemoryConnect.VAULT_NOT_FOUND);
    }

    @Test
    void shouldUpdateItem() throws Exception {
        // given
        var created = await(connect.createItem(vault.id(), login("Email")));

        // when
        var updated = await(connect.updateItem(vault.id(), created.withTitle("Updated Title").withTags(Set.of("tag1", "tag2"))));

        // then
        assertThat(updated.id()).isEqualTo(created.id());
        assertThat(updated.title()).isEqualTo("Updated Title");
        assertThat(updated.tags()).containsExactlyInAnyOrder("tag1", "tag2");
        assertThat(updated.version()).isEqualTo(2);
        assertThat(updated.createdAt()).isEqualTo(created.createdAt());
        assertThat(await(connect.getItem(vault.id(), created.id())).title()).isEqualTo("Updated Title");
    }

    @Test
    void shouldFailToUpdateUnknownItem() throws Exception {
        var created = await(connect.createItem(vault.id(), login("Email")));
        await(connect.deleteItem(vault.id(), created.id()));

        var e = failure(connect.updateItem(vault.id(), created));

        assertEquals(new ErrorResponse(404, InMemoryConnect.ITEM_NOT_FOUND), e.errorResponse());
    }

    @Test
    void shouldDeleteItem() throws Exception {
        // given
        var created = await(connect.createItem(vault.id(), login("Email")));

        // when
        await(connect.deleteItem(vault.id(), created.id()));

        // then
        assertThat(failure(connect.getItem(vault.id(), created.id())).status()).isEqualTo(404);
        assertThat(failure(connect.deleteItem(vault.id(), created.id())).status()).isEqualTo(404);
        assertThat(await(connect.listItems(vault.id()))).isEmpty();
    }

    @Test
    void shouldListSummaries() throws Exception {
        // given
        var item = new ItemBuilder()
                .setCategory(Category.LOGIN)
                .setTitle("Email")
                .addField(Field.builder().label("password").generate().build())
                .build();
        await(connect.createItem(vault.id(), item));
        await(connect.createItem(vault.id(), login("Bank")));

        // when
        var items = await(connect.listItems(vault.id()));

        // then
        assertThat(items).extracting(Item::title).containsExactly("Email", "Bank");
        assertThat(items).allSatisfy(summary -> assertThat(summary.fields()).isEmpty());
    }

    @Test
    void shouldFilterByTitle() throws Exception {
        await(connect.createItem(vault.id(), login("Email")));
        await(connect.createItem(vault.id(), login("Bank")));

        var items = await(connect.listItems(vault.id(), ItemFilter.titleEquals("Bank")));

        assertThat(items).extracting(Item::title).containsExactly("Bank");
    }

    @Test
    void shouldGetItemByTitle() throws Exception {
        // given
        var created = await(connect.createItem(vault.id(), login("Email")));
        await(connect.createItem(vault.id(), login("Bank")));

        // when
        FullItem found = await(connect.getItemByTitle(vault.id(), "Email"));

        // then
        assertThat(found).isEqualTo(created);
    }

    @Test
    void shouldReportMissingAndAmbiguousTitles() throws Exception {
        await(connect.createItem(vault.id(), login("Twin")));
        await(connect.createItem(vault.id(), login("Twin")));

        assertEquals(TitleResolver.NO_ITEMS_FOUND, failure(connect.getItemByTitle(vault.id(), "Nobody")).errorResponse());
        assertEquals(TitleResolver.MULTIPLE_ITEMS_FOUND, failure(connect.getItemByTitle(vault.id(), "Twin")).errorResponse());
    }

    private static Item login(String title) {
        return new ItemBuilder().setCategory(Category.LOGIN).setTitle(title).build();
    }

    private static <T> T await(CompletionStage<T> stage) throws Exception {
        return stage.toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private static ConnectException failure(CompletionStage<?> stage) {
        var e = assertThrows(ExecutionException.class, () -> stage.toCompletableFuture().get(5, TimeUnit.SECONDS));
        return assertInstanceOf(ConnectException.class, e.getCause());
    }
}
