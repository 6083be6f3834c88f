package org.witlang.compiler.ir;

import org.witlang.compiler.isa.Register;
import org.witlang.compiler.types.Type;

/**
 * A temporary value held in a machine register.
 *
 * @param register The register holding the value.
 * @param type The type of the value.
 */
public record RegItem(Register register, Type type) implements Item {

    @Override
    public boolean isAddressable() {
        return false;
    }

    @Override
    public RegItem retype(Type type) {
        return new RegItem(register, type);
    }
}
