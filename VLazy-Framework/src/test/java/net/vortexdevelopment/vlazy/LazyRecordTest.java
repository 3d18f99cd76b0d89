package net.vortexdevelopment.vlazy;

import net.vortexdevelopment.vlazy.config.RegistrySettings;
import net.vortexdevelopment.vlazy.exception.ConfigurationException;
import net.vortexdevelopment.vlazy.exception.MissingAttributeException;
import net.vortexdevelopment.vlazy.exception.RequiredAttributeException;
import net.vortexdevelopment.vlazy.exception.UndeclaredPropertyException;
import net.vortexdevelopment.vlazy.property.PropertyOptions;
import net.vortexdevelopment.vlazy.property.PropertyRegistry;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the public instance API of {@link LazyRecord}.
 */
class LazyRecordTest {

    @Test
    void constructionFailsWithoutRequiredKey() {
        assertThatThrownBy(() -> new User(Map.of("name", "Ada")))
                .isInstanceOfSatisfying(RequiredAttributeException.class, e -> {
                    assertThat(e.getPropertyName()).isEqualTo("id");
                    assertThat(e.getRecordType()).isEqualTo(User.class);
                })
                .hasMessage("User requires `id`");
    }

    @Test
    void readAppliesTransform() {
        User user = new User(Map.of("id", 1, "age", "21"));

        assertThat(user.getAge()).isEqualTo(21);
        assertThat(user.read("age", Integer.class)).isEqualTo(21);
    }

    @Test
    void readUsesDefaultWithoutTransform() {
        User user = new User(Map.of("id", 1));

        assertThat(user.getAge()).isEqualTo(0);
    }

    @Test
    void lenientGetReturnsNullForMissingValue() {
        User user = new User(Map.of("id", 1));

        assertThat(user.get("email")).isNull();
        assertThat(user.find("email")).isEmpty();
        assertThatThrownBy(() -> user.read("email"))
                .isInstanceOf(MissingAttributeException.class)
                .hasMessage("`email_address` is missing for User");
    }

    @Test
    void lenientGetDoesNotHideUndeclaredProperties() {
        User user = new User(Map.of("id", 1));

        assertThatThrownBy(() -> user.get("password")).isInstanceOf(UndeclaredPropertyException.class);
    }

    @Test
    void setOverridesSourceValue() {
        User user = new User(Map.of("id", 1, "age", "21"));

        user.set("age", 42);

        assertThat(user.read("age")).isEqualTo(42);
    }

    @Test
    void setAllWritesInIterationOrder() {
        User user = new User(Map.of("id", 1));
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", "Ada");
        values.put("age", 36);

        user.setAll(values);

        assertThat(user.read("name")).isEqualTo("Ada");
        assertThat(user.read("age")).isEqualTo(36);
    }

    @Test
    void unsetRevealsSourceValueAgain() {
        User user = new User(Map.of("id", 1, "name", "Ada"));
        user.set("name", "Grace");

        assertThat(user.unset("name")).isTrue();
        assertThat(user.read("name")).isEqualTo("Ada");
    }

    @Test
    void setAllWritesNothingWhenAnyNameIsUndeclared() {
        User user = new User(Map.of("id", 1, "name", "Ada"));
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", "Grace");
        values.put("bogus", 1);

        assertThatThrownBy(() -> user.setAll(values))
                .isInstanceOf(UndeclaredPropertyException.class)
                .hasMessageContaining("bogus");
        assertThat(user.read("name")).isEqualTo("Ada");
        assertThat(user.resolver().isWritten("name")).isFalse();
    }

    @Test
    void reloadCannotBeOverridden() throws NoSuchMethodException {
        assertThat(Modifier.isFinal(LazyRecord.class.getMethod("reload").getModifiers())).isTrue();
    }

    @Test
    void defaultReloadMarksFullyLoaded() {
        User user = new User(Map.of("id", 1));
        assertThat(user.isFullyLoaded()).isFalse();

        assertThat(user.reload()).isSameAs(user);
        assertThat(user.isFullyLoaded()).isTrue();
    }

    @Test
    void fullyLoadedCanBeResetByTheRecord() {
        User user = new User(Map.of("id", 1));
        user.setFullyLoaded(true);
        assertThat(user.isFullyLoaded()).isTrue();

        user.setFullyLoaded(false);
        assertThat(user.isFullyLoaded()).isFalse();
    }

    @Test
    void toMapIsStrictByDefault() {
        User user = new User(Map.of("id", 1, "age", "21", "name", "Ada", "email_address", "ada@example.com"));

        assertThat(user.toMap())
                .containsEntry("id", 1)
                .containsEntry("age", 21)
                .containsEntry("name", "Ada")
                .containsEntry("email", "ada@example.com");
    }

    @Test
    void lenientToMapAndToStringNeverLoad() {
        User user = new User(Map.of("id", 1, "age", "21"));
        user.read("age");

        assertThat(user.toMap(false)).containsOnlyKeys("age");
        assertThat(user.toString()).isEqualTo("User{age=21}");
        assertThat(user.isFullyLoaded()).isFalse();
    }

    @Test
    void recordsWithEqualIdentityAreEqual() {
        User first = new User(Map.of("id", 7, "name", "Ada"));
        User second = new User(Map.of("id", 7, "name", "Grace"));
        User third = new User(Map.of("id", 8, "name", "Ada"));

        assertThat(first).isEqualTo(second);
        assertThat(first).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(third);
    }

    @Test
    void recordsOfDifferentTypesAreNotEqual() {
        User user = new User(Map.of("id", 7));
        Admin admin = new Admin(Map.of("id", 7));

        assertThat(user).isNotEqualTo(admin);
        assertThat(admin).isNotEqualTo(user);
    }

    @Test
    void recordsWithoutIdentityUseReferenceEquality() {
        Note first = new Note(Map.of("text", "hello"));
        Note second = new Note(Map.of("text", "hello"));

        assertThat(first).isEqualTo(first);
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void recordsMissingIdentityValueUseReferenceEquality() {
        Ticket first = new Ticket(Map.of("title", "A"));
        Ticket second = new Ticket(Map.of("title", "B"));
        Ticket numbered = new Ticket(Map.of("code", "T-1", "title", "C"));
        Ticket sameNumber = new Ticket(Map.of("code", "T-1", "title", "D"));

        assertThat(first).isEqualTo(first);
        assertThat(first).isNotEqualTo(second);
        assertThat(first).isNotEqualTo(numbered);
        assertThat(numbered).isNotEqualTo(first);
        assertThat(first.hashCode()).isEqualTo(System.identityHashCode(first));
        assertThat(numbered).isEqualTo(sameNumber);
        assertThat(numbered).hasSameHashCodeAs(sameNumber);
    }

    @Test
    void subclassInheritsAndExtendsProperties() {
        Admin admin = new Admin(Map.of("id", 1, "level", "3", "age", "50"));

        assertThat(admin.read("level")).isEqualTo(3);
        assertThat(admin.getAge()).isEqualTo(50);
        assertThat(User.PROPERTIES.contains("level")).isFalse();
        assertThat(Admin.PROPERTIES.names()).containsExactly("id", "age", "name", "email", "level");
    }

    @Test
    void registryOfAnotherTypeIsRejected() {
        assertThatThrownBy(() -> new Mismatched(Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining(User.class.getName());
    }

    @Test
    void transformReceivesTheOwningRecord() {
        Note note = new Note(Map.of("text", "hello", "loud", true));

        assertThat(note.read("shout")).isEqualTo("HELLO");
    }

    static class User extends LazyRecord {
        static final PropertyRegistry<User> PROPERTIES = PropertyRegistry.forType(User.class, RegistrySettings.builder().build())
                .property("id", PropertyOptions.<User>builder().required().identity().build())
                .property("age", PropertyOptions.<User>builder().with((String value) -> Integer.valueOf(value)).defaultValue(0).build())
                .property("name")
                .property("email", PropertyOptions.<User>builder().from("email_address").build());

        User(Map<String, ?> attributes) {
            this(PROPERTIES, attributes);
        }

        protected <R> User(PropertyRegistry<R> registry, Map<String, ?> attributes) {
            super(registry, attributes);
        }

        Integer getAge() {
            return read("age", Integer.class);
        }
    }

    static class Admin extends User {
        static final PropertyRegistry<Admin> PROPERTIES = User.PROPERTIES.inheritInto(Admin.class)
                .property("level", PropertyOptions.<Admin>builder().with((String value) -> Integer.valueOf(value)).build());

        Admin(Map<String, ?> attributes) {
            super(PROPERTIES, attributes);
        }
    }

    static class Note extends LazyRecord {
        static final PropertyRegistry<Note> PROPERTIES = PropertyRegistry.forType(Note.class, RegistrySettings.builder().build())
                .property("text")
                .property("loud", PropertyOptions.<Note>builder().defaultValue(false).build())
                .property("shout", PropertyOptions.<Note>builder()
                        .from("text")
                        .withRecord((note, value) -> Boolean.TRUE.equals(note.get("loud"))
                                ? value.toString().toUpperCase()
                                : value)
                        .build());

        Note(Map<String, ?> attributes) {
            super(PROPERTIES, attributes);
        }
    }

    static class Ticket extends LazyRecord {
        static final PropertyRegistry<Ticket> PROPERTIES = PropertyRegistry.forType(Ticket.class, RegistrySettings.builder().build())
                .property("code", PropertyOptions.<Ticket>builder().identity().build())
                .property("title");

        Ticket(Map<String, ?> attributes) {
            super(PROPERTIES, attributes);
        }
    }

    static class Mismatched extends LazyRecord {
        Mismatched(Map<String, ?> attributes) {
            super(User.PROPERTIES, attributes);
        }
    }
}
