package ir;

import ir.value.instructions.*;

public interface InstructionVisitor<T> {
    T visit(ConstInst inst);

    T visit(BinOperator inst);

    T visit(ICmpInst inst);

    T visit(UnaryOperator inst);

    // memory
    T visit(AllocInst inst);

    T visit(FreeInst inst);

    T visit(PtrAddInst inst);

    T visit(LoadInst inst);

    T visit(StoreInst inst);

    T visit(IdInst inst);

    // control
    T visit(BranchInst inst);

    T visit(JumpInst inst);

    T visit(ReturnInst inst);

    T visit(PrintInst inst);
}
