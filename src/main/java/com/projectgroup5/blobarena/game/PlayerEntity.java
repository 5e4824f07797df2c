package com.projectgroup5.blobarena.game;

import com.projectgroup5.blobarena.config.GameProperties;
import com.projectgroup5.blobarena.game.skill.PullSkill;
import com.projectgroup5.blobarena.game.skill.PushSkill;
import com.projectgroup5.blobarena.game.skill.Skill;
import com.projectgroup5.blobarena.game.survival.SurvivalStats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 玩家实体（服务器权威）
 * 半径由分数推导，所有字段只在世界锁内修改
 */
public class PlayerEntity extends Entity {

    private final int id;
    private final String name;
    private final GameProperties.Player settings;
    private final Map<String, Skill> skills = new LinkedHashMap<>();

    private long score;
    private boolean alive = true;
    private long respawnAt;
    private long lastMoveSequence = -1;

    // 下一帧要应用的移动意图（单位向量或 0）
    private double intentDx;
    private double intentDy;
    private boolean moving;

    private SurvivalStats survivalStats;

    public PlayerEntity(int id, String name, double x, double y, List<Integer> color,
                        GameProperties.Player settings, GameProperties.Skills skillSettings) {
        super(x, y, settings.getBaseRadius(), color);
        this.id = id;
        this.name = name;
        this.settings = settings;
        skills.put(PushSkill.NAME, new PushSkill(skillSettings.getPush()));
        skills.put(PullSkill.NAME, new PullSkill(skillSettings.getPull()));
    }

    @Override
    public EntityKind kind() {
        return EntityKind.PLAYER;
    }

    /**
     * radius = base + (score * factor) ^ exponent，限制在 [base, max]
     */
    public static double radiusForScore(long score, GameProperties.Player cfg) {
        double growth = Math.pow(Math.max(0, score) * cfg.getGrowthFactor(), cfg.getGrowthExponent());
        double r = cfg.getBaseRadius() + growth;
        if (!Double.isFinite(r)) {
            return cfg.getMaxRadius();
        }
        return Math.max(cfg.getBaseRadius(), Math.min(cfg.getMaxRadius(), r));
    }

    /**
     * 体积越大速度越慢，最低为 minSpeed
     */
    public double speed() {
        double decay = settings.getSpeedDecay();
        double v = settings.getBaseSpeed();
        if (decay > 0) {
            v = v * Math.pow(settings.getBaseRadius() / radius, decay);
        }
        return Math.max(settings.getMinSpeed(), v);
    }

    public void addScore(long amount) {
        if (amount <= 0) {
            return;
        }
        score += amount;
        radius = radiusForScore(score, settings);
    }

    /**
     * 记录移动意图；序号不大于已处理序号的包直接丢弃
     *
     * @return 是否被接受
     */
    public boolean recordIntent(double dx, double dy, long sequence) {
        if (sequence <= lastMoveSequence) {
            return false;
        }
        lastMoveSequence = sequence;
        if (!Double.isFinite(dx) || !Double.isFinite(dy)) {
            dx = 0;
            dy = 0;
        }
        // 先按最大分量缩放，极大的有限值求长度时不会溢出
        double scale = Math.max(Math.abs(dx), Math.abs(dy));
        if (scale > 0) {
            double sx = dx / scale;
            double sy = dy / scale;
            double len = Math.sqrt(sx * sx + sy * sy);
            intentDx = sx / len;
            intentDy = sy / len;
        } else {
            intentDx = 0;
            intentDy = 0;
        }
        return true;
    }

    /**
     * 取出意图并清零
     */
    public double[] consumeIntent() {
        double[] intent = {intentDx, intentDy};
        intentDx = 0;
        intentDy = 0;
        moving = intent[0] != 0 || intent[1] != 0;
        return intent;
    }

    public void kill(long respawnAt) {
        this.alive = false;
        this.respawnAt = respawnAt;
        this.intentDx = 0;
        this.intentDy = 0;
        this.moving = false;
    }

    /**
     * 重生：分数清零，技能重置
     */
    public void respawn(double x, double y) {
        this.score = 0;
        this.radius = radiusForScore(0, settings);
        this.alive = true;
        this.respawnAt = 0;
        this.intentDx = 0;
        this.intentDy = 0;
        this.moving = false;
        setPosition(x, y);
        skills.values().forEach(Skill::reset);
        if (survivalStats != null) {
            survivalStats = new SurvivalStats();
        }
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public long getScore() {
        return score;
    }

    public boolean isAlive() {
        return alive;
    }

    public long getRespawnAt() {
        return respawnAt;
    }

    public long getLastMoveSequence() {
        return lastMoveSequence;
    }

    public double getIntentDx() {
        return intentDx;
    }

    public double getIntentDy() {
        return intentDy;
    }

    public boolean isMoving() {
        return moving;
    }

    public Map<String, Skill> getSkills() {
        return Collections.unmodifiableMap(skills);
    }

    public Skill getSkill(String skillName) {
        return skills.get(skillName);
    }

    public SurvivalStats getSurvivalStats() {
        return survivalStats;
    }

    public void setSurvivalStats(SurvivalStats survivalStats) {
        this.survivalStats = survivalStats;
    }

    @Override
    public String toString() {
        return "Player(id=" + id + ", name='" + name + "', score=" + score + ", x=" + x + ", y=" + y + ")";
    }
}
