package com.raditha.cildiff.model;

/**
 * Visitor over statement payloads. The flavor disambiguates payload records shared by
 * several statement kinds.
 *
 * @param <R> result type
 */
public interface CilDataVisitor<R> {

    R visit(AccessVectorRule data, CilFlavor flavor);

    R visit(Association data, CilFlavor flavor);

    R visit(AttributeSet data, CilFlavor flavor);

    R visit(BooleanDecl data, CilFlavor flavor);

    R visit(Branch data, CilFlavor flavor);

    R visit(Call data, CilFlavor flavor);

    R visit(CategorySet data, CilFlavor flavor);

    R visit(ClassMapping data, CilFlavor flavor);

    R visit(ClassPermissionSet data, CilFlavor flavor);

    R visit(ClassPerms data, CilFlavor flavor);

    R visit(Conditional data, CilFlavor flavor);

    R visit(Constraint data, CilFlavor flavor);

    R visit(Context data, CilFlavor flavor);

    R visit(DefaultObject data, CilFlavor flavor);

    R visit(DeviceCon data, CilFlavor flavor);

    R visit(DeviceTreeCon data, CilFlavor flavor);

    R visit(ExpandTypeAttribute data, CilFlavor flavor);

    R visit(ExtendedAccessVectorRule data, CilFlavor flavor);

    R visit(FileCon data, CilFlavor flavor);

    R visit(FsUse data, CilFlavor flavor);

    R visit(GenFsCon data, CilFlavor flavor);

    R visit(IbEndPortCon data, CilFlavor flavor);

    R visit(IbPkeyCon data, CilFlavor flavor);

    R visit(InStatement data, CilFlavor flavor);

    R visit(IpAddr data, CilFlavor flavor);

    R visit(Level data, CilFlavor flavor);

    R visit(LevelRange data, CilFlavor flavor);

    R visit(Macro data, CilFlavor flavor);

    R visit(NameStatement data, CilFlavor flavor);

    R visit(NetIfCon data, CilFlavor flavor);

    R visit(NodeCon data, CilFlavor flavor);

    R visit(OrderStatement data, CilFlavor flavor);

    R visit(PermissionX data, CilFlavor flavor);

    R visit(PolicySetting data, CilFlavor flavor);

    R visit(PortCon data, CilFlavor flavor);

    R visit(RangeTransition data, CilFlavor flavor);

    R visit(Root data, CilFlavor flavor);

    R visit(SelinuxUser data, CilFlavor flavor);

    R visit(SensitivityCategory data, CilFlavor flavor);

    R visit(SidContext data, CilFlavor flavor);

    R visit(TransitionRule data, CilFlavor flavor);

    R visit(UserLevel data, CilFlavor flavor);

    R visit(UserRange data, CilFlavor flavor);

    R visit(ValidateTrans data, CilFlavor flavor);
}
