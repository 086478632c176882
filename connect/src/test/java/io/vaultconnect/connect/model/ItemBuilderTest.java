/*
 * Copyright Vault Connect Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.vaultconnect.connect.model;

import java.util.List;
import java.util.function.Supplier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.vaultconnect.connect.service.ConnectException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ItemBuilderTest {

    private ItemBuilder builder;

    @BeforeEach
    void before() {
        Supplier<String> sectionIds = new Supplier<>() {
            private int next = 1;

            @Override
            public String get() {
                return "section" + next++;
            }
        };
        builder = new ItemBuilder(sectionIds);
    }

    @Test
    void shouldRequireCategory() {
        builder.setTitle("Secret Recipe");

        assertThatThrownBy(builder::build)
                .isInstanceOf(ConnectException.class)
                .hasMessage("400: Item Category must be defined.");
    }

    @Test
    void shouldRejectNullCategory() {
        assertThrows(NullPointerException.class, () -> builder.setCategory(null));
    }

    @Test
    void shouldBuildMinimalItemWithDefaults() {
        // when
        var item = builder.setCategory(Category.LOGIN).build();

        // then
        assertThat(item.id()).isNull();
        assertThat(item.vault()).isNull();
        assertThat(item.title()).isEqualTo(ItemBuilder.DEFAULT_TITLE);
        assertThat(item.category()).isEqualTo(Category.LOGIN);
        assertThat(item.favorite()).isFalse();
        assertThat(item.tags()).isEmpty();
        assertThat(item.urls()).isEmpty();
        assertThat(item.sections()).isEmpty();
        assertThat(item.fields()).isEmpty();
    }

    @Test
    void shouldUseLastCategorySet() {
        var item = builder.setCategory(Category.LOGIN)
                .setCategory(Category.PASSWORD)
                .build();

        assertThat(item.category()).isEqualTo(Category.PASSWORD);
    }

    @Test
    void shouldBuildFullyPopulatedItem() {
        // given
        builder.setCategory(Category.LOGIN)
                .setTitle("Bank of Example")
                .setFavorite(true)
                .addTag("finance")
                .addTag("personal")
                .addTag("finance")
                .addUrl(ItemUrl.primary("https://bank.example.com"));
        var section = builder.addSection("Security Questions");
        builder.addField(Field.builder().label("username").value("jdoe").purpose(FieldPurpose.USERNAME).build())
                .addField(Field.builder().label("First pet").value("Rex").type(FieldType.CONCEALED).build(), section);

        // when
        var item = builder.build();

        // then
        assertThat(item.title()).isEqualTo("Bank of Example");
        assertThat(item.favorite()).isTrue();
        assertThat(item.tags()).containsExactly("finance", "personal");
        assertThat(item.urls()).containsExactly(new ItemUrl(null, true, "https://bank.example.com"));
        assertThat(item.sections()).containsExactly(new Section("section1", "Security Questions"));
        assertThat(item.fields()).hasSize(2);
        assertThat(item.fields().get(0).section()).isNull();
        assertThat(item.fields().get(0).purpose()).isEqualTo(FieldPurpose.USERNAME);
        assertThat(item.fields().get(1).section()).isEqualTo(new SectionRef("section1"));
        assertThat(item.fields().get(1).type()).isEqualTo(FieldType.CONCEALED);
    }

    @Test
    void shouldKeepOnlyOnePrimaryUrl() {
        var item = builder.setCategory(Category.LOGIN)
                .addUrl(ItemUrl.primary("https://one.example.com"))
                .addUrl(ItemUrl.secondary("https://two.example.com"))
                .addUrl(ItemUrl.primary("https://three.example.com"))
                .build();

        assertThat(item.urls()).extracting(ItemUrl::primary).containsExactly(false, false, true);
        assertThat(item.urls()).extracting(ItemUrl::href)
                .containsExactly("https://one.example.com", "https://two.example.com", "https://three.example.com");
    }

    @Test
    void shouldAssignDistinctSectionIds() {
        var first = builder.addSection("One");
        var second = builder.addSection("Two");

        assertThat(first.sectionId()).isEqualTo("section1");
        assertThat(second.sectionId()).isEqualTo("section2");
        assertThat(second.index()).isEqualTo(1);
    }

    @Test
    void shouldRejectDuplicateSectionId() {
        builder.addSection("One", "custom");

        var e = assertThrows(ConnectException.class, () -> builder.addSection("Two", "custom"));
        assertThat(e.status()).isEqualTo(400);
        assertThat(e.errorResponse().message()).isEqualTo("Section 'custom' is already defined on this item");
    }

    @Test
    void shouldRejectFieldForUnknownSection() {
        // given
        var field = Field.builder().label("pin").build().withSection(new SectionRef("elsewhere"));

        // when
        var e = assertThrows(ConnectException.class, () -> builder.addField(field));

        // then
        assertThat(e.status()).isEqualTo(400);
        assertThat(e.errorResponse().message()).isEqualTo("Section 'elsewhere' is not defined on this item");
    }

    @Test
    void shouldRejectHandleFromAnotherBuilder() {
        // given
        var other = new ItemBuilder(() -> "foreign");
        var foreignHandle = other.addSection("Other");
        var field = Field.builder().label("pin").build();

        // when
        var e = assertThrows(ConnectException.class, () -> builder.addField(field, foreignHandle));

        // then
        assertThat(e.errorResponse().message()).isEqualTo("Section 'foreign' is not defined on this item");
    }

    @Test
    void shouldAcceptFieldReferringToOwnSection() {
        builder.addSection("Details", "details");
        var field = Field.builder().label("pin").build().withSection(new SectionRef("details"));

        var item = builder.setCategory(Category.SECURE_NOTE).addField(field).build();

        assertThat(item.fields()).containsExactly(field);
    }

    @Test
    void shouldSnapshotOnBuild() {
        // given
        builder.setCategory(Category.LOGIN).setTitle("First").addTag("a");
        var first = builder.build();

        // when
        builder.setTitle("Second").addTag("b");
        var second = builder.build();

        // then
        assertThat(first.title()).isEqualTo("First");
        assertThat(first.tags()).containsExactly("a");
        assertThat(second.title()).isEqualTo("Second");
        assertThat(second.tags()).containsExactly("a", "b");
    }

    @Test
    void shouldReturnImmutableCollections() {
        var item = builder.setCategory(Category.LOGIN).addTag("a").build();

        assertThrows(UnsupportedOperationException.class, () -> item.tags().add("b"));
        assertThrows(UnsupportedOperationException.class, () -> item.fields().add(Field.builder().build()));
        assertThat(item.sections()).isEqualTo(List.of());
    }

    @Test
    void shouldGenerateIdentifiersOfFixedLength() {
        var ids = new Identifiers();

        var id = ids.get();

        assertThat(id).hasSize(Identifiers.LENGTH).matches("[a-z0-9]+");
        assertThat(ids.get()).isNotEqualTo(id);
    }
}
