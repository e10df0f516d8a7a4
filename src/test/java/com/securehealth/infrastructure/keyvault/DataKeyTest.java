package com.securehealth.infrastructure.keyvault;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DataKeyTest {

    @Test
    void keyMaterialCannotBeChangedThroughTheInstance() {
        byte[] material = {1, 2, 3};
        DataKey key = DataKey.builder().id(UUID.randomUUID()).altName("k").keyMaterial(material).build();

        material[0] = 9;
        key.getKeyMaterial()[1] = 9;

        assertArrayEquals(new byte[] {1, 2, 3}, key.getKeyMaterial());
    }

    @Test
    void equalMaterialGivesEqualKeys() {
        UUID id = UUID.randomUUID();
        DataKey a = DataKey.builder().id(id).altName("k").keyMaterial(new byte[] {1, 2}).build();
        DataKey b = DataKey.builder().id(id).altName("k").keyMaterial(new byte[] {1, 2}).build();

        assertEquals(a, b);
        assertFalse(a.toString().contains("keyMaterial"));
    }
}
