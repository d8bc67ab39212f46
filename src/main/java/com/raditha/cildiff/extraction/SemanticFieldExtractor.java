package com.raditha.cildiff.extraction;

import com.raditha.cildiff.hash.Digest;
import com.raditha.cildiff.hash.HashState;
import com.raditha.cildiff.model.AccessVectorRule;
import com.raditha.cildiff.model.Association;
import com.raditha.cildiff.model.AttributeSet;
import com.raditha.cildiff.model.BooleanDecl;
import com.raditha.cildiff.model.Branch;
import com.raditha.cildiff.model.Call;
import com.raditha.cildiff.model.CategorySet;
import com.raditha.cildiff.model.CilData;
import com.raditha.cildiff.model.CilDataVisitor;
import com.raditha.cildiff.model.CilExpr;
import com.raditha.cildiff.model.CilFlavor;
import com.raditha.cildiff.model.CilNode;
import com.raditha.cildiff.model.ClassMapping;
import com.raditha.cildiff.model.ClassPermissionSet;
import com.raditha.cildiff.model.ClassPerms;
import com.raditha.cildiff.model.Conditional;
import com.raditha.cildiff.model.Constraint;
import com.raditha.cildiff.model.Context;
import com.raditha.cildiff.model.DefaultObject;
import com.raditha.cildiff.model.DeviceCon;
import com.raditha.cildiff.model.DeviceTreeCon;
import com.raditha.cildiff.model.ExpandTypeAttribute;
import com.raditha.cildiff.model.ExtendedAccessVectorRule;
import com.raditha.cildiff.model.FileCon;
import com.raditha.cildiff.model.FsUse;
import com.raditha.cildiff.model.GenFsCon;
import com.raditha.cildiff.model.IbEndPortCon;
import com.raditha.cildiff.model.IbPkeyCon;
import com.raditha.cildiff.model.InStatement;
import com.raditha.cildiff.model.IpAddr;
import com.raditha.cildiff.model.Level;
import com.raditha.cildiff.model.LevelRange;
import com.raditha.cildiff.model.Macro;
import com.raditha.cildiff.model.NameStatement;
import com.raditha.cildiff.model.NetIfCon;
import com.raditha.cildiff.model.NodeCon;
import com.raditha.cildiff.model.OrderStatement;
import com.raditha.cildiff.model.PermissionX;
import com.raditha.cildiff.model.PolicyModelException;
import com.raditha.cildiff.model.PolicySetting;
import com.raditha.cildiff.model.PortCon;
import com.raditha.cildiff.model.RangeTransition;
import com.raditha.cildiff.model.Ref;
import com.raditha.cildiff.model.Root;
import com.raditha.cildiff.model.SelinuxUser;
import com.raditha.cildiff.model.SensitivityCategory;
import com.raditha.cildiff.model.SidContext;
import com.raditha.cildiff.model.TransitionRule;
import com.raditha.cildiff.model.UserLevel;
import com.raditha.cildiff.model.UserRange;
import com.raditha.cildiff.model.ValidateTrans;

import java.util.ArrayList;
import java.util.List;

/**
 * Feeds the semantic fields of a statement into running digests.
 * <p>
 * Every digest starts with the flavor tag. Identity fields are absorbed first; for statements
 * that relate a key to a value the running digest is then forked into the partial digest and
 * the value fields are absorbed into the full digest only. Two statements with the same
 * partial digest are candidates for the same slot in a policy.
 * <p>
 * Named references hash their name, inline anonymous structures hash to the full digest of
 * the structure.
 */
public class SemanticFieldExtractor {

    static final String EXPR_TAG = "<expr>";
    static final String EXPR_OPERATOR_TAG = "<expr_op>";
    static final String LIST_TAG = "<list>";
    static final String STRING_TAG = "<string>";
    static final String ORDERED = "<ordered>";
    static final String UNORDERED = "<unordered>";

    /**
     * Open the digests of one statement. Container children are not absorbed here.
     */
    public FieldHashes extract(CilNode node) {
        FieldHasher hasher = new FieldHasher(node.getFlavor());
        node.getData().accept(hasher, node.getFlavor());
        return new FieldHashes(hasher.full, hasher.partial);
    }

    /**
     * Full digest of a payload, as used for inline anonymous structures.
     */
    public Digest dataHash(CilFlavor flavor, CilData data) {
        FieldHasher hasher = new FieldHasher(flavor);
        data.accept(hasher, flavor);
        return hasher.full.finish();
    }

    /**
     * Digest of an expression. Operands are sorted unless the operator gives them positions.
     */
    public Digest exprHash(CilExpr expr) {
        HashState state = HashState.begin(EXPR_TAG);
        if (expr.operator() != null) {
            state.updateString(EXPR_OPERATOR_TAG);
            state.updateString(expr.operator().getKeyword());
        }
        List<Digest> operands = new ArrayList<>(expr.operands().size());
        for (CilExpr.Operand operand : expr.operands()) {
            operands.add(operand.expr() != null ? exprHash(operand.expr()) : Digest.ofString(operand.name()));
        }
        if (!expr.isOrdered()) {
            operands.sort(null);
        }
        operands.forEach(state::update);
        return state.finish();
    }

    /**
     * Digest of a list of names.
     *
     * @param ordered whether positions carry meaning
     */
    public Digest listHash(List<String> names, boolean ordered) {
        HashState state = HashState.begin(LIST_TAG);
        state.updateString(ordered ? ORDERED : UNORDERED);
        List<Digest> elements = new ArrayList<>(names.size());
        for (String name : names) {
            elements.add(Digest.ofString(name));
        }
        if (!ordered) {
            elements.sort(null);
        }
        elements.forEach(state::update);
        return state.finish();
    }

    /**
     * Digest of a call argument tree. Arguments are positional at every level.
     */
    public Digest argumentHash(Call.Argument argument) {
        HashState state = HashState.begin(argument.isList() ? LIST_TAG : STRING_TAG);
        if (!argument.isList()) {
            state.updateString(argument.value());
        }
        for (Call.Argument child : argument.children()) {
            state.update(argumentHash(child));
        }
        return state.finish();
    }

    /**
     * Absorbs the fields of one payload. A new hasher is used for every extraction.
     */
    private final class FieldHasher implements CilDataVisitor<Void> {

        private final HashState full;
        private HashState partial;

        FieldHasher(CilFlavor flavor) {
            this.full = HashState.begin(flavor.getTag());
        }

        /**
         * Fork the partial digest off at the current position.
         */
        private void split() {
            partial = full.copy();
        }

        private void string(String value) {
            full.updateString(value);
        }

        private void nameOrAnonymous(String name, CilFlavor flavor) {
            full.updateString(name != null ? name : "<anonymous::" + flavor.getTag() + ">");
        }

        private void ref(Ref<? extends CilData> ref, CilFlavor inlineFlavor) {
            if (ref.isNamed()) {
                full.updateString(ref.name());
            } else {
                full.update(dataHash(inlineFlavor, ref.inline()));
            }
        }

        private void classPerms(Ref<ClassPerms> ref) {
            if (ref.isNamed()) {
                full.update(HashState.begin(CilFlavor.CLASSPERMS_SET.getTag()).updateString(ref.name()).finish());
            } else {
                full.update(dataHash(CilFlavor.CLASSPERMS, ref.inline()));
            }
        }

        private void context(Ref<Context> ref) {
            ref(ref, CilFlavor.CONTEXT);
        }

        @Override
        public Void visit(Root data, CilFlavor flavor) {
            return null;
        }

        @Override
        public Void visit(Branch data, CilFlavor flavor) {
            return null;
        }

        @Override
        public Void visit(NameStatement data, CilFlavor flavor) {
            if (flavor == CilFlavor.OPTIONAL) {
                // optional blocks are matched and compared by content only
                split();
                return null;
            }
            string(data.name());
            return null;
        }

        @Override
        public Void visit(Association data, CilFlavor flavor) {
            string(data.subject());
            if (flavor != CilFlavor.ROLEBOUNDS && flavor != CilFlavor.TYPEBOUNDS && flavor != CilFlavor.USERBOUNDS) {
                split();
            }
            string(data.object());
            return null;
        }

        @Override
        public Void visit(AttributeSet data, CilFlavor flavor) {
            string(data.attribute());
            split();
            full.update(exprHash(data.expression()));
            return null;
        }

        @Override
        public Void visit(OrderStatement data, CilFlavor flavor) {
            if (data.unordered() && flavor != CilFlavor.CLASSORDER) {
                throw new PolicyModelException(flavor.getDisplayName() + " cannot be marked with 'unordered' keyword");
            }
            split();
            full.update(listHash(data.order(), !data.unordered()));
            return null;
        }

        @Override
        public Void visit(AccessVectorRule data, CilFlavor flavor) {
            string(data.source());
            string(data.target());
            split();
            classPerms(data.classPerms());
            return null;
        }

        @Override
        public Void visit(ExtendedAccessVectorRule data, CilFlavor flavor) {
            string(data.source());
            string(data.target());
            split();
            ref(data.permissionX(), CilFlavor.PERMISSIONX);
            return null;
        }

        @Override
        public Void visit(Call data, CilFlavor flavor) {
            string(data.macro());
            full.update(argumentHash(Call.Argument.list(data.arguments())));
            return null;
        }

        @Override
        public Void visit(Macro data, CilFlavor flavor) {
            string(data.name());
            split();
            for (Macro.Parameter parameter : data.parameters()) {
                string(parameter.type());
                string(parameter.name());
            }
            return null;
        }

        @Override
        public Void visit(ClassPerms data, CilFlavor flavor) {
            string(data.className());
            split();
            full.update(exprHash(data.permissions()));
            return null;
        }

        @Override
        public Void visit(ClassPermissionSet data, CilFlavor flavor) {
            string(data.name());
            split();
            full.update(dataHash(CilFlavor.CLASSPERMS, data.classPerms()));
            return null;
        }

        @Override
        public Void visit(ClassMapping data, CilFlavor flavor) {
            string(data.classMap());
            string(data.mapPerm());
            split();
            classPerms(data.classPerms());
            return null;
        }

        @Override
        public Void visit(PermissionX data, CilFlavor flavor) {
            nameOrAnonymous(data.name(), flavor);
            string(data.kind());
            string(data.className());
            split();
            full.update(exprHash(data.permissions()));
            return null;
        }

        @Override
        public Void visit(BooleanDecl data, CilFlavor flavor) {
            string(data.name());
            split();
            full.updateBoolean(data.value());
            return null;
        }

        @Override
        public Void visit(Conditional data, CilFlavor flavor) {
            full.update(exprHash(data.condition()));
            split();
            return null;
        }

        @Override
        public Void visit(Constraint data, CilFlavor flavor) {
            classPerms(data.classPerms());
            split();
            full.update(exprHash(data.expression()));
            return null;
        }

        @Override
        public Void visit(ValidateTrans data, CilFlavor flavor) {
            string(data.className());
            split();
            full.update(exprHash(data.expression()));
            return null;
        }

        @Override
        public Void visit(InStatement data, CilFlavor flavor) {
            full.updateBoolean(data.after());
            string(data.block());
            return null;
        }

        @Override
        public Void visit(Context data, CilFlavor flavor) {
            nameOrAnonymous(data.name(), flavor);
            split();
            string(data.user());
            string(data.role());
            string(data.type());
            ref(data.range(), CilFlavor.LEVELRANGE);
            return null;
        }

        @Override
        public Void visit(DefaultObject data, CilFlavor flavor) {
            string(data.object());
            if (data.range() != null) {
                string(data.range());
            }
            split();
            full.update(listHash(data.classes(), false));
            return null;
        }

        @Override
        public Void visit(FileCon data, CilFlavor flavor) {
            string(data.path());
            string(data.fileType());
            split();
            if (data.context() != null) {
                string("<context>");
                context(data.context());
            } else {
                string("<empty_context>");
            }
            return null;
        }

        @Override
        public Void visit(FsUse data, CilFlavor flavor) {
            string(data.type());
            string(data.fileSystem());
            context(data.context());
            return null;
        }

        @Override
        public Void visit(GenFsCon data, CilFlavor flavor) {
            string(data.fileSystem());
            string(data.path());
            // an omitted file type means any
            string(data.fileType() != null ? data.fileType() : "any");
            split();
            context(data.context());
            return null;
        }

        @Override
        public Void visit(IbPkeyCon data, CilFlavor flavor) {
            string(data.subnetPrefix());
            full.updateLong(data.low());
            full.updateLong(data.high());
            split();
            context(data.context());
            return null;
        }

        @Override
        public Void visit(IbEndPortCon data, CilFlavor flavor) {
            string(data.device());
            full.updateLong(data.port());
            split();
            context(data.context());
            return null;
        }

        @Override
        public Void visit(CategorySet data, CilFlavor flavor) {
            nameOrAnonymous(data.name(), flavor);
            split();
            full.update(exprHash(data.categories()));
            return null;
        }

        @Override
        public Void visit(SensitivityCategory data, CilFlavor flavor) {
            string(data.sensitivity());
            split();
            full.update(exprHash(data.categories()));
            return null;
        }

        @Override
        public Void visit(Level data, CilFlavor flavor) {
            nameOrAnonymous(data.name(), flavor);
            split();
            string(data.sensitivity());
            if (data.categories() != null) {
                full.update(exprHash(data.categories()));
            }
            return null;
        }

        @Override
        public Void visit(LevelRange data, CilFlavor flavor) {
            nameOrAnonymous(data.name(), flavor);
            split();
            ref(data.low(), CilFlavor.LEVEL);
            ref(data.high(), CilFlavor.LEVEL);
            return null;
        }

        @Override
        public Void visit(RangeTransition data, CilFlavor flavor) {
            string(data.source());
            string(data.executable());
            string(data.objectClass());
            split();
            ref(data.range(), CilFlavor.LEVELRANGE);
            return null;
        }

        @Override
        public Void visit(IpAddr data, CilFlavor flavor) {
            nameOrAnonymous(data.name(), flavor);
            split();
            full.update(data.toBytes());
            return null;
        }

        @Override
        public Void visit(NetIfCon data, CilFlavor flavor) {
            string(data.interfaceName());
            split();
            context(data.interfaceContext());
            context(data.packetContext());
            return null;
        }

        @Override
        public Void visit(NodeCon data, CilFlavor flavor) {
            ref(data.address(), CilFlavor.IPADDR);
            ref(data.mask(), CilFlavor.IPADDR);
            split();
            context(data.context());
            return null;
        }

        @Override
        public Void visit(PortCon data, CilFlavor flavor) {
            string(data.protocol());
            full.updateLong(data.low());
            full.updateLong(data.high());
            split();
            context(data.context());
            return null;
        }

        @Override
        public Void visit(PolicySetting data, CilFlavor flavor) {
            split();
            string(data.value());
            return null;
        }

        @Override
        public Void visit(TransitionRule data, CilFlavor flavor) {
            string(data.source());
            string(data.target());
            string(data.objectClass());
            if (data.objectName() != null) {
                string(data.objectName());
            }
            split();
            string(data.result());
            return null;
        }

        @Override
        public Void visit(SidContext data, CilFlavor flavor) {
            string(data.sid());
            split();
            context(data.context());
            return null;
        }

        @Override
        public Void visit(ExpandTypeAttribute data, CilFlavor flavor) {
            full.updateBoolean(data.expand());
            split();
            full.update(listHash(data.attributes(), false));
            return null;
        }

        @Override
        public Void visit(UserLevel data, CilFlavor flavor) {
            string(data.user());
            split();
            ref(data.level(), CilFlavor.LEVEL);
            return null;
        }

        @Override
        public Void visit(UserRange data, CilFlavor flavor) {
            string(data.user());
            split();
            ref(data.range(), CilFlavor.LEVELRANGE);
            return null;
        }

        @Override
        public Void visit(SelinuxUser data, CilFlavor flavor) {
            if (data.name() != null) {
                string(data.name());
            }
            split();
            string(data.user());
            ref(data.range(), CilFlavor.LEVELRANGE);
            return null;
        }

        @Override
        public Void visit(DeviceCon data, CilFlavor flavor) {
            full.updateLong(data.low());
            if (flavor == CilFlavor.IOMEMCON || flavor == CilFlavor.IOPORTCON) {
                full.updateLong(data.high());
            }
            split();
            context(data.context());
            return null;
        }

        @Override
        public Void visit(DeviceTreeCon data, CilFlavor flavor) {
            string(data.path());
            split();
            context(data.context());
            return null;
        }
    }
}
